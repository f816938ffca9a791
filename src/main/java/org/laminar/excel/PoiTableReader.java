package org.laminar.excel;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link TableReader} over Apache POI. Reads {@code .xlsx}, {@code .xlsm} and {@code .xls} workbooks.
 * <p>
 * The first row of a sheet is the header row. Cells are read as Excel displays them, formulas are
 * evaluated, rows without any text are skipped.
 */
public class PoiTableReader implements TableReader {

    private static final Logger log = LoggerFactory.getLogger(PoiTableReader.class);

    public static final Set<String> EXCEL_EXTENSIONS = Set.of(".xlsx", ".xlsm", ".xls");
    public static final String PLACEHOLDER_HEADER_PREFIX = "Unnamed: ";

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public List<String> sheetNames(Path workbook) throws SourceReadException {
        try (Workbook wb = open(workbook)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < wb.getNumberOfSheets(); i++) {
                names.add(wb.getSheetName(i));
            }
            return names;
        } catch (SourceReadException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceReadException("Failed to read workbook: " + workbook, e);
        }
    }

    @Override
    public SheetTable readSheet(Path workbook, String sheetName) throws SourceReadException {
        try (Workbook wb = open(workbook)) {
            Sheet sheet = wb.getSheet(sheetName);
            if (sheet == null) {
                throw new SourceReadException("Sheet '" + sheetName + "' not found in " + workbook);
            }
            FormulaEvaluator evaluator = wb.getCreationHelper().createFormulaEvaluator();
            SheetTable table = readTable(sheet, evaluator);
            log.debug("Read sheet '{}' from {}: {} columns, {} rows",
                    sheetName, workbook.getFileName(), table.headers().size(), table.rows().size());
            return table;
        } catch (SourceReadException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceReadException("Failed to read sheet '" + sheetName + "' from " + workbook, e);
        }
    }

    public static boolean isExcelFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXCEL_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private Workbook open(Path workbook) throws SourceReadException {
        if (!Files.isRegularFile(workbook)) {
            throw new SourceReadException("Workbook not found: " + workbook);
        }
        try {
            return WorkbookFactory.create(workbook.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new SourceReadException("Failed to open workbook: " + workbook, e);
        }
    }

    private SheetTable readTable(Sheet sheet, FormulaEvaluator evaluator) {
        int headerRowNum = sheet.getFirstRowNum();
        Row headerRow = headerRowNum < 0 ? null : sheet.getRow(headerRowNum);
        if (headerRow == null || headerRow.getLastCellNum() <= 0) {
            return new SheetTable(sheet.getSheetName(), List.of(), List.of());
        }

        List<String> headers = readHeaders(headerRow, evaluator);

        List<Map<String, String>> rows = new ArrayList<>();
        for (int rowNum = headerRowNum + 1; rowNum <= sheet.getLastRowNum(); rowNum++) {
            Row row = sheet.getRow(rowNum);
            if (row == null) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            boolean hasText = false;
            for (int i = 0; i < headers.size(); i++) {
                String value = cellText(row.getCell(i), evaluator);
                hasText |= !value.isEmpty();
                values.put(headers.get(i), value);
            }
            if (hasText) {
                rows.add(values);
            }
        }
        return new SheetTable(sheet.getSheetName(), headers, rows);
    }

    private List<String> readHeaders(Row headerRow, FormulaEvaluator evaluator) {
        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < headerRow.getLastCellNum(); i++) {
            String header = cellText(headerRow.getCell(i), evaluator);
            if (header.isEmpty()) {
                header = PLACEHOLDER_HEADER_PREFIX + i;
            }
            // repeated headers get a numeric suffix so every column keeps its own key
            String unique = header;
            int suffix = 1;
            while (!seen.add(unique)) {
                unique = header + "." + suffix++;
            }
            headers.add(unique);
        }
        return headers;
    }

    private String cellText(Cell cell, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell, evaluator).trim();
    }
}
