package org.laminar.process.models;

import lombok.Builder;
import org.laminar.process.StepIds;
import org.laminar.process.SystemStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single step of a business process.
 * <p>
 * A plain step uses {@code nextStep} only, a decision step ({@code CONDITION::} id) uses the
 * yes/no pair only. Keys of the process JSON that have no typed field here are kept in
 * {@code additionalAttributes}, in their original order, and written back unchanged.
 */
@Builder(toBuilder = true)
public record Step(
        String stepId,
        String stepRole,
        String stepTitle,
        String stepDescription,
        String nextStep,
        String nextStepYes,
        String nextStepNo,
        List<String> stepNotes,
        String manualSystem,       // "MANUAL" or the executing system
        String userCredentials,    // user_role_code_user_id_user_name
        String passwordInfo,       // password_in_test_system
        String usersName,
        String programLocation,    // program_id_t_code_screen_name
        String yesWhen,
        String noWhen,
        Map<String, Object> additionalAttributes) {

    public Step {
        if (stepTitle == null) {
            stepTitle = "";
        }
        stepNotes = stepNotes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(stepNotes));
        // values may legitimately be null, so no Map.copyOf here
        additionalAttributes = additionalAttributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalAttributes));
    }

    public boolean isCondition() {
        return StepIds.isCondition(stepId);
    }

    public boolean isSystemStep() {
        return StepIds.isSystem(stepId);
    }

    public boolean isStart() {
        return SystemStep.START.matches(stepId);
    }

    public boolean isEnd() {
        return SystemStep.END.matches(stepId);
    }

    public boolean isAbort() {
        return SystemStep.ABORT.matches(stepId);
    }

    public String strippedId() {
        return StepIds.strip(stepId);
    }

    public boolean hasConditionalFlow() {
        return nextStepYes != null || nextStepNo != null;
    }

    public boolean hasAnnotations() {
        return (stepDescription != null && !stepDescription.isEmpty()) || !stepNotes.isEmpty();
    }

    /**
     * Creates a control step with its default title and no outgoing edges.
     */
    public static Step system(SystemStep systemStep) {
        return Step.builder()
                .stepId(systemStep.id())
                .stepTitle(systemStep.label())
                .build();
    }
}
