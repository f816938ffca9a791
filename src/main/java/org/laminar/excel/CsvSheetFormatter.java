package org.laminar.excel;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats a sheet as semicolon separated text for the extraction oracle.
 * Empty cells and placeholder headers are written as {@code --}, semicolons inside values become commas.
 */
public class CsvSheetFormatter {

    public static final String SEPARATOR = ";";
    public static final String MISSING_VALUE_PLACEHOLDER = "--";

    public static String format(SheetTable table) {
        StringBuilder csv = new StringBuilder();
        csv.append(formatLine(table.headers().stream()
                .map(header -> header.startsWith(PoiTableReader.PLACEHOLDER_HEADER_PREFIX.trim()) ? "" : header)
                .collect(Collectors.toList())));
        for (Map<String, String> row : table.rows()) {
            csv.append(formatLine(table.headers().stream()
                    .map(header -> SheetTable.cell(row, header))
                    .collect(Collectors.toList())));
        }
        return csv.toString();
    }

    private static String formatLine(List<String> values) {
        return values.stream()
                .map(CsvSheetFormatter::formatValue)
                .collect(Collectors.joining(SEPARATOR)) + "\n";
    }

    private static String formatValue(String value) {
        if (value == null || value.isBlank()) {
            return MISSING_VALUE_PLACEHOLDER;
        }
        return value.trim()
                .replace(SEPARATOR, ",")
                .replace("\r\n", " ")
                .replace('\n', ' ');
    }
}
