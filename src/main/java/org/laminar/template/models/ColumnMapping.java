package org.laminar.template.models;

import java.util.List;
import java.util.Locale;

/**
 * A column definition of the template: its type, whether it is required and the header
 * aliases it answers to.
 */
public record ColumnMapping(ColumnType columnType, boolean required, List<String> aliases) {

    public ColumnMapping {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    /**
     * A header matches when, trimmed and lowercased, it equals the type tag written with spaces,
     * without underscores or as is, or one of the aliases (case-insensitive).
     */
    public boolean matches(String header) {
        if (header == null) {
            return false;
        }
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        String tag = columnType.tag();
        if (normalized.equals(tag.replace('_', ' '))
                || normalized.equals(tag.replace("_", ""))
                || normalized.equals(tag)) {
            return true;
        }
        return aliases.stream().anyMatch(alias -> alias.toLowerCase(Locale.ROOT).equals(normalized));
    }
}
