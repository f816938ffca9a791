package org.laminar.excel;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvSheetFormatterTest {

    @Test
    void shouldWritePlaceholdersAndReplaceSeparators() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Step", "1");
        row.put("Unnamed: 1", "");
        row.put("Notes", "check; sign\nlater");

        SheetTable table = new SheetTable("Approval", List.of("Step", "Unnamed: 1", "Notes"), List.of(row));

        assertEquals("Step;--;Notes\n1;--;check, sign later\n", CsvSheetFormatter.format(table));
    }

    @Test
    void shouldWriteMissingCellsAsPlaceholder() {
        SheetTable table = new SheetTable("Approval", List.of("Step", "Role"), List.of(Map.of("Step", "1")));

        assertEquals("Step;Role\n1;--\n", CsvSheetFormatter.format(table));
    }
}
