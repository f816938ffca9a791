package org.laminar.template;

import org.junit.jupiter.api.Test;
import org.laminar.process.SystemStep;
import org.laminar.process.models.Step;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemStepSynthesizerTest {

    private static Step step(String id, String next) {
        return Step.builder().stepId(id).stepTitle(id).nextStep(next).build();
    }

    private static List<String> ids(List<Step> steps) {
        return steps.stream().map(Step::stepId).toList();
    }

    @Test
    void shouldAppendStartPointingToFirstRowStepAndEnd() {
        List<Step> result = SystemStepSynthesizer.ensureSystemSteps(List.of(step("step_4", null), step("step_5", null)));

        assertEquals(List.of("step_4", "step_5", "SYSTEM::START", "SYSTEM::END"), ids(result));
        assertEquals("step_4", result.get(2).nextStep());
        assertEquals("Start", result.get(2).stepTitle());
    }

    @Test
    void shouldNotDuplicateExistingControlSteps() {
        List<Step> input = List.of(
                step("SYSTEM::START", "step_1"),
                step("step_1", "SYSTEM::END"),
                Step.system(SystemStep.END));

        assertEquals(ids(input), ids(SystemStepSynthesizer.ensureSystemSteps(input)));
    }

    @Test
    void shouldAddOnlyEndForEmptyInput() {
        assertEquals(List.of("SYSTEM::END"), ids(SystemStepSynthesizer.ensureSystemSteps(List.of())));
    }

    @Test
    void shouldAddAbortOnlyWhenReferenced() {
        List<Step> withoutAbort = SystemStepSynthesizer.ensureSystemSteps(List.of(step("step_1", null)));
        assertFalse(withoutAbort.stream().anyMatch(Step::isAbort));

        Step decision = Step.builder()
                .stepId("CONDITION::1")
                .stepTitle("Ok?")
                .nextStepYes("SYSTEM::END")
                .nextStepNo("SYSTEM::ABORT")
                .build();
        List<Step> withAbort = SystemStepSynthesizer.ensureSystemSteps(List.of(decision, step("step_2", "SYSTEM::ABORT")));

        assertEquals(1, withAbort.stream().filter(Step::isAbort).count());
        assertEquals("SYSTEM::ABORT", withAbort.get(withAbort.size() - 1).stepId());
    }

    @Test
    void shouldLeaveInputUntouched() {
        List<Step> input = new ArrayList<>(List.of(step("step_1", null)));

        SystemStepSynthesizer.ensureSystemSteps(input);

        assertEquals(List.of("step_1"), ids(input));
    }
}
