package org.laminar.extraction;

/**
 * Result of extracting one sheet of a batch: either a result or the failure message.
 */
public record SheetOutcome(String sheetName, ExtractionResult result, String error) {

    public static SheetOutcome success(String sheetName, ExtractionResult result) {
        return new SheetOutcome(sheetName, result, null);
    }

    public static SheetOutcome failure(String sheetName, String error) {
        return new SheetOutcome(sheetName, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
