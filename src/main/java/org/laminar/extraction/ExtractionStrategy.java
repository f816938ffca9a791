package org.laminar.extraction;

import org.laminar.excel.SheetTable;

/**
 * One way of turning a sheet into a process.
 */
public interface ExtractionStrategy {

    ExtractionMethod method();

    ExtractionResult extract(SheetTable table) throws ProcessExtractionException;
}
