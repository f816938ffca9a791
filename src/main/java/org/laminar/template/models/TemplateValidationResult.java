package org.laminar.template.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of matching a sheet's headers against the template columns.
 *
 * @param valid            all required columns present and at least three columns matched
 * @param confidence       0.6 * required ratio + 0.4 * overall ratio, between 0 and 1
 * @param matchedColumns   column type to the header text bound to it, in binding order
 * @param missingRequired  required column types with no header, in template order
 * @param unmatchedHeaders headers that match no column type
 * @param ignoredHeaders   headers that match a column type already bound by an earlier header
 * @param messages         human readable summary
 */
public record TemplateValidationResult(
        boolean valid,
        double confidence,
        Map<ColumnType, String> matchedColumns,
        List<ColumnType> missingRequired,
        List<String> unmatchedHeaders,
        List<String> ignoredHeaders,
        List<String> messages) {

    public static final double CONFIDENCE_THRESHOLD = 0.7;

    public TemplateValidationResult {
        matchedColumns = Collections.unmodifiableMap(new LinkedHashMap<>(matchedColumns));
        missingRequired = List.copyOf(missingRequired);
        unmatchedHeaders = List.copyOf(unmatchedHeaders);
        ignoredHeaders = List.copyOf(ignoredHeaders);
        messages = List.copyOf(messages);
    }

    /**
     * Whether the sheet can be parsed without the extraction oracle.
     */
    public boolean canParseDirectly() {
        return valid && missingRequired.isEmpty() && confidence >= CONFIDENCE_THRESHOLD;
    }

    public boolean hasColumn(ColumnType columnType) {
        return matchedColumns.containsKey(columnType);
    }

    public String headerFor(ColumnType columnType) {
        return matchedColumns.get(columnType);
    }
}
