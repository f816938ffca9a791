package org.laminar.process;

import org.laminar.process.models.Process;
import org.laminar.process.models.Role;
import org.laminar.process.models.Step;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks over a process graph.
 */
public class ProcessGraphHelper {

    /**
     * Bare ids used by more than one step. {@code step_3} and {@code CONDITION::3} do not collide,
     * {@code 3} and {@code CONDITION::3} do.
     *
     * @return duplicated bare ids in order of first appearance
     */
    public static List<String> findDuplicateStepIds(Process process) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Step step : process.processSteps()) {
            String bareId = step.strippedId();
            if (!seen.add(bareId)) {
                duplicates.add(bareId);
            }
        }
        return new ArrayList<>(duplicates);
    }

    /**
     * Steps whose role is set but names no role of the process.
     *
     * @return step id to unknown role id, in process order
     */
    public static Map<String, String> findUnknownRoleReferences(Process process) {
        Set<String> roleIds = new LinkedHashSet<>();
        for (Role role : process.processRoles()) {
            roleIds.add(role.roleId());
        }

        Map<String, String> unknown = new LinkedHashMap<>();
        for (Step step : process.processSteps()) {
            String roleId = step.stepRole();
            if (roleId != null && !roleId.isBlank() && !roleIds.contains(roleId)) {
                unknown.put(step.stepId(), roleId);
            }
        }
        return unknown;
    }

    public static void validateUniqueStepIds(Process process) {
        List<String> duplicates = findDuplicateStepIds(process);
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Process '" + process.processId()
                    + "' contains duplicate step ids: " + String.join(", ", duplicates));
        }
    }

    /**
     * Checks that every transition of the process points at one of its steps.
     *
     * @return "source -> target" entries for transitions whose target is not a step of the process
     */
    public static List<String> findDanglingReferences(Process process) {
        List<String> dangling = new ArrayList<>();
        for (Step step : process.processSteps()) {
            for (String target : new String[]{step.nextStep(), step.nextStepYes(), step.nextStepNo()}) {
                if (target != null && !target.isBlank() && process.findStep(target) == null) {
                    dangling.add(step.stepId() + " -> " + target);
                }
            }
        }
        return dangling;
    }
}
