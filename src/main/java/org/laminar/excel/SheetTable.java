package org.laminar.excel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One sheet read into memory: ordered headers and ordered rows of header to cell text.
 * Missing cells read as empty strings.
 */
public record SheetTable(String sheetName, List<String> headers, List<Map<String, String>> rows) {

    public SheetTable {
        headers = headers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(headers));
        List<Map<String, String>> copiedRows = new ArrayList<>();
        if (rows != null) {
            for (Map<String, String> row : rows) {
                copiedRows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copiedRows);
    }

    /**
     * @return the trimmed cell text, or "" when the header is null or the cell is missing
     */
    public static String cell(Map<String, String> row, String header) {
        if (header == null) {
            return "";
        }
        String value = row.get(header);
        return value == null ? "" : value.trim();
    }
}
