package org.laminar.extraction;

import org.laminar.excel.SheetTable;
import org.laminar.excel.SourceReadException;
import org.laminar.excel.TableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts processes from workbook sheets, choosing between the template parser and the
 * extraction oracle according to an {@link ExtractionPolicy}.
 * <ul>
 *     <li>AUTO: template; the oracle when the sheet does not match the template</li>
 *     <li>FORCE_AI: oracle only</li>
 *     <li>FORCE_TEMPLATE: template only, a mismatch is a failure</li>
 * </ul>
 */
public class ProcessExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExtractor.class);

    private final TableReader tableReader;
    private final ExtractionPolicy policy;
    private final ExtractionStrategy templateStrategy;
    private final ExtractionStrategy oracleStrategy;

    /**
     * @param oracleStrategy may be null, then only FORCE_TEMPLATE and template-compliant sheets work
     */
    public ProcessExtractor(TableReader tableReader,
                            ExtractionPolicy policy,
                            ExtractionStrategy templateStrategy,
                            ExtractionStrategy oracleStrategy) {
        this.tableReader = tableReader;
        this.policy = policy;
        this.templateStrategy = templateStrategy;
        this.oracleStrategy = oracleStrategy;
    }

    public ExtractionPolicy getPolicy() {
        return policy;
    }

    /**
     * Extracts the process of one sheet.
     *
     * @throws SourceReadException        if the sheet cannot be read
     * @throws ProcessExtractionException if no allowed strategy produced a process
     */
    public ExtractionResult extract(Path workbook, String sheetName)
            throws SourceReadException, ProcessExtractionException {
        SheetTable table = tableReader.readSheet(workbook, sheetName);
        return extract(table);
    }

    public ExtractionResult extract(SheetTable table) throws ProcessExtractionException {
        switch (policy) {
            case FORCE_AI -> {
                log.info("Sheet '{}': using oracle (forced)", table.sheetName());
                return runOracle(table);
            }
            case FORCE_TEMPLATE -> {
                ExtractionResult result = templateStrategy.extract(table);
                logResult(table, result);
                return result;
            }
            default -> {
                try {
                    ExtractionResult result = templateStrategy.extract(table);
                    logResult(table, result);
                    return result;
                } catch (TemplateMismatchException e) {
                    log.info("Sheet '{}' does not match the template, falling back to oracle", table.sheetName());
                    return runOracle(table).withValidation(e.getValidation());
                }
            }
        }
    }

    /**
     * Extracts every sheet of the workbook. A sheet that cannot be read or extracted is recorded as
     * a failure and the remaining sheets are still processed.
     *
     * @throws SourceReadException if the workbook itself cannot be opened
     */
    public BatchExtractionResult extractAll(Path workbook) throws SourceReadException {
        List<String> sheetNames = tableReader.sheetNames(workbook);
        log.info("Extracting {} sheets from {}", sheetNames.size(), workbook.getFileName());

        List<SheetOutcome> outcomes = new ArrayList<>();
        for (String sheetName : sheetNames) {
            try {
                outcomes.add(SheetOutcome.success(sheetName, extract(workbook, sheetName)));
            } catch (SourceReadException e) {
                log.error("Sheet '{}' could not be read: {}", sheetName, e.getMessage());
                outcomes.add(SheetOutcome.failure(sheetName, e.getMessage()));
            } catch (ProcessExtractionException e) {
                log.error("Sheet '{}' failed: {}", sheetName, e.getMessage());
                outcomes.add(SheetOutcome.failure(sheetName, e.getMessage()));
            }
        }
        return new BatchExtractionResult(workbook, outcomes);
    }

    private ExtractionResult runOracle(SheetTable table) throws ProcessExtractionException {
        if (oracleStrategy == null) {
            throw new ProcessExtractionException("Sheet '" + table.sheetName()
                    + "' needs the extraction oracle, but none is configured");
        }
        ExtractionResult result = oracleStrategy.extract(table);
        logResult(table, result);
        return result;
    }

    private static void logResult(SheetTable table, ExtractionResult result) {
        log.info("Sheet '{}': extracted {} steps using {} (confidence {})",
                table.sheetName(), result.process().processSteps().size(), result.method(), result.confidence());
    }
}
