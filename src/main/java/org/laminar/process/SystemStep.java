package org.laminar.process;

/**
 * The singleton control steps of a process.
 */
public enum SystemStep {
    START("SYSTEM::START", "Start"),
    END("SYSTEM::END", "End"),
    ABORT("SYSTEM::ABORT", "Abort");

    private final String id;
    private final String label;

    SystemStep(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean matches(String stepId) {
        return id.equals(stepId);
    }

    /**
     * @return the control step with the given full id, or null if the id is not a control step id
     */
    public static SystemStep fromId(String stepId) {
        for (SystemStep systemStep : values()) {
            if (systemStep.id.equals(stepId)) {
                return systemStep;
            }
        }
        return null;
    }
}
