package org.laminar.process;

/**
 * Reserved step id prefixes and helpers for working with bare ids.
 * <p>
 * A {@code CONDITION::} prefix marks a decision step, a {@code SYSTEM::} prefix marks one of the
 * control steps (see {@link SystemStep}). The bare id (prefix removed) is the identity used for
 * cross-referencing and as the diagram node id.
 */
public final class StepIds {

    public static final String CONDITION_PREFIX = "CONDITION::";
    public static final String SYSTEM_PREFIX = "SYSTEM::";

    private static final String[] RESERVED_PREFIXES = {CONDITION_PREFIX, SYSTEM_PREFIX};

    private StepIds() {
    }

    /**
     * Removes any leading reserved prefixes.
     * An id without a reserved prefix is returned unchanged, so stripping is idempotent.
     *
     * @param stepId the step id, may be null
     * @return the bare id, or null for a null input
     */
    public static String strip(String stepId) {
        if (stepId == null) {
            return null;
        }
        String bare = stepId;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : RESERVED_PREFIXES) {
                if (bare.startsWith(prefix)) {
                    bare = bare.substring(prefix.length());
                    stripped = true;
                }
            }
        }
        return bare;
    }

    public static boolean isCondition(String stepId) {
        return stepId != null && stepId.startsWith(CONDITION_PREFIX);
    }

    public static boolean isSystem(String stepId) {
        return stepId != null && stepId.startsWith(SYSTEM_PREFIX);
    }

    public static String condition(String bareId) {
        return CONDITION_PREFIX + strip(bareId);
    }

    /**
     * Two ids name the same step when their bare forms are equal.
     */
    public static boolean sameStep(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return strip(left).equals(strip(right));
    }
}
