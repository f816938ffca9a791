package org.laminar.extraction;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-sheet outcomes of extracting a whole workbook, in sheet order.
 */
public record BatchExtractionResult(Path workbook, List<SheetOutcome> outcomes) {

    public BatchExtractionResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @return true only if every sheet was extracted
     */
    public boolean isSuccess() {
        return outcomes.stream().allMatch(SheetOutcome::isSuccess);
    }

    public List<SheetOutcome> successes() {
        return outcomes.stream().filter(SheetOutcome::isSuccess).toList();
    }

    public List<SheetOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }
}
