package org.laminar.extraction;

import java.util.Locale;

/**
 * Which extraction strategies may be used for a sheet.
 */
public enum ExtractionPolicy {
    /** Template first, the oracle when the sheet does not follow the template. */
    AUTO,
    FORCE_AI,
    FORCE_TEMPLATE;

    public static ExtractionPolicy fromFlags(boolean forceAi, boolean forceTemplate) {
        if (forceAi && forceTemplate) {
            throw new IllegalArgumentException("forceAi and forceTemplate are mutually exclusive");
        }
        if (forceAi) {
            return FORCE_AI;
        }
        return forceTemplate ? FORCE_TEMPLATE : AUTO;
    }

    public static ExtractionPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown extraction policy: " + value
                    + " (expected AUTO, FORCE_AI or FORCE_TEMPLATE)", e);
        }
    }
}
