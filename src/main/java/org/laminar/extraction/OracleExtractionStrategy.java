package org.laminar.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import org.laminar.excel.CsvSheetFormatter;
import org.laminar.excel.SheetTable;
import org.laminar.oracle.ExtractionOracle;
import org.laminar.oracle.OracleException;
import org.laminar.process.ProcessJsonHelper;
import org.laminar.process.models.Process;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts a process through the {@link ExtractionOracle}. When an image directory is given, a
 * {@code <sheet name>.png} found there is sent along with the sheet text.
 */
public class OracleExtractionStrategy implements ExtractionStrategy {

    public static final double ORACLE_CONFIDENCE = 0.9;

    private final ExtractionOracle oracle;
    private final Path imageDir;

    public OracleExtractionStrategy(ExtractionOracle oracle) {
        this(oracle, null);
    }

    public OracleExtractionStrategy(ExtractionOracle oracle, Path imageDir) {
        this.oracle = oracle;
        this.imageDir = imageDir;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.AI;
    }

    @Override
    public ExtractionResult extract(SheetTable table) throws ProcessExtractionException {
        String csv = CsvSheetFormatter.format(table);
        JsonNode document;
        try {
            document = oracle.extractProcess(csv, table.sheetName(), sheetImage(table.sheetName()));
        } catch (OracleException e) {
            throw new ProcessExtractionException("Oracle extraction failed for sheet '" + table.sheetName()
                    + "' (" + e.getReason() + "): " + e.getMessage(), e);
        }

        Process process;
        try {
            process = ProcessJsonHelper.parse(document);
        } catch (IllegalArgumentException e) {
            throw new ProcessExtractionException("Oracle returned an unusable process for sheet '"
                    + table.sheetName() + "'", e);
        }
        return new ExtractionResult(process, ExtractionMethod.AI, ORACLE_CONFIDENCE, null, null);
    }

    private Path sheetImage(String sheetName) {
        if (imageDir == null) {
            return null;
        }
        Path image = imageDir.resolve(sheetName + ".png");
        return Files.isRegularFile(image) ? image : null;
    }
}
