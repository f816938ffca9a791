package org.laminar.excel;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads spreadsheet workbooks as plain tables.
 */
public interface TableReader {

    List<String> sheetNames(Path workbook) throws SourceReadException;

    SheetTable readSheet(Path workbook, String sheetName) throws SourceReadException;
}
