package org.laminar.process;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StepIdsTest {

    @Test
    void shouldReturnUnprefixedIdUnchanged() {
        assertEquals("step_1", StepIds.strip("step_1"));
        assertEquals("", StepIds.strip(""));
        assertNull(StepIds.strip(null));
    }

    @Test
    void shouldStripReservedPrefixes() {
        assertEquals("2", StepIds.strip("CONDITION::2"));
        assertEquals("START", StepIds.strip("SYSTEM::START"));
        assertEquals("x", StepIds.strip("CONDITION::SYSTEM::x"));
    }

    @Test
    void shouldBeIdempotent() {
        for (String id : new String[]{"step_1", "CONDITION::2", "SYSTEM::END", "CONDITION::CONDITION::3", "a::b"}) {
            String once = StepIds.strip(id);
            assertEquals(once, StepIds.strip(once), id);
        }
    }

    @Test
    void shouldOnlyStripLeadingPrefix() {
        assertEquals("step_CONDITION::1", StepIds.strip("step_CONDITION::1"));
    }

    @Test
    void shouldCompareBareIds() {
        assertTrue(StepIds.sameStep("CONDITION::2", "2"));
        assertFalse(StepIds.sameStep("step_2", "CONDITION::2"));
        assertFalse(StepIds.sameStep(null, "2"));
        assertEquals("CONDITION::7", StepIds.condition("7"));
        assertEquals("CONDITION::7", StepIds.condition("CONDITION::7"));
    }

    @Test
    void shouldRecognizeSystemSteps() {
        assertEquals(SystemStep.ABORT, SystemStep.fromId("SYSTEM::ABORT"));
        assertNull(SystemStep.fromId("ABORT"));
        assertTrue(StepIds.isSystem("SYSTEM::END"));
        assertTrue(StepIds.isCondition("CONDITION::1"));
        assertFalse(StepIds.isCondition("step_1"));
    }
}
