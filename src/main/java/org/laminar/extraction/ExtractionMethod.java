package org.laminar.extraction;

/**
 * The strategy that actually produced a process.
 */
public enum ExtractionMethod {
    TEMPLATE("template"),
    AI("ai");

    private final String label;

    ExtractionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
