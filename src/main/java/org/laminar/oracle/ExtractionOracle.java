package org.laminar.oracle;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Infers a process from a loosely structured sheet.
 */
public interface ExtractionOracle {

    /**
     * @param csv       the sheet as semicolon separated text
     * @param sheetName name of the sheet, used as the process name
     * @param imagePath optional rendering of the sheet, may be null
     * @return a document in the process JSON format
     * @throws OracleException if no valid process document could be obtained
     */
    JsonNode extractProcess(String csv, String sheetName, Path imagePath) throws OracleException;
}
