package org.laminar.process.models;

import org.laminar.process.StepIds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A business process: its roles and its steps in authoring order.
 * Step order is significant, it determines the order of nodes inside each swimlane.
 */
public record Process(
        String processId,
        String processName,
        List<Role> processRoles,
        List<Step> processSteps) {

    public Process {
        processRoles = processRoles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(processRoles));
        processSteps = processSteps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(processSteps));
    }

    /**
     * Finds a step by id. Reserved prefixes are ignored on both sides, so {@code CONDITION::3}
     * and {@code 3} find the same step.
     *
     * @param stepId the id to search for
     * @return the first matching step, or null if none matches
     */
    public Step findStep(String stepId) {
        if (stepId == null) {
            return null;
        }
        String bareId = StepIds.strip(stepId);
        for (Step step : processSteps) {
            if (stepId.equals(step.stepId()) || bareId.equals(step.strippedId())) {
                return step;
            }
        }
        return null;
    }

    public Role findRole(String roleId) {
        if (roleId == null) {
            return null;
        }
        return processRoles.stream()
                .filter(role -> roleId.equals(role.roleId()))
                .findFirst()
                .orElse(null);
    }
}
