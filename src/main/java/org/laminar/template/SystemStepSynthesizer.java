package org.laminar.template;

import org.laminar.process.SystemStep;
import org.laminar.process.models.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds the control steps a template-built process needs.
 */
public class SystemStepSynthesizer {

    /**
     * Returns a new step list with, appended in this order:
     * <ul>
     *     <li>START pointing to the first row step, if there is no START and there is a row step</li>
     *     <li>END, if there is none</li>
     *     <li>ABORT, if a transition references it and there is none</li>
     * </ul>
     * The input list is not modified.
     */
    public static List<Step> ensureSystemSteps(List<Step> steps) {
        List<Step> result = new ArrayList<>(steps);

        if (!contains(result, SystemStep.START)) {
            result.stream()
                    .filter(step -> !step.isSystemStep())
                    .findFirst()
                    .ifPresent(first -> result.add(Step.system(SystemStep.START).toBuilder()
                            .nextStep(first.stepId())
                            .build()));
        }

        if (!contains(result, SystemStep.END)) {
            result.add(Step.system(SystemStep.END));
        }

        if (isReferenced(result, SystemStep.ABORT) && !contains(result, SystemStep.ABORT)) {
            result.add(Step.system(SystemStep.ABORT));
        }

        return result;
    }

    private static boolean contains(List<Step> steps, SystemStep systemStep) {
        return steps.stream().anyMatch(step -> systemStep.matches(step.stepId()));
    }

    private static boolean isReferenced(List<Step> steps, SystemStep systemStep) {
        return steps.stream().anyMatch(step -> systemStep.matches(step.nextStep())
                || systemStep.matches(step.nextStepYes())
                || systemStep.matches(step.nextStepNo()));
    }
}
