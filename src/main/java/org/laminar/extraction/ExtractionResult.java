package org.laminar.extraction;

import org.laminar.process.models.Process;
import org.laminar.template.ReferenceStats;
import org.laminar.template.models.TemplateValidationResult;

/**
 * A process extracted from one sheet.
 *
 * @param process        the extracted process
 * @param method         strategy that produced it
 * @param confidence     template confidence, or the fixed oracle confidence
 * @param validation     the template validation, null when the template was not tried
 * @param referenceStats transition resolution of the template parse, empty for the oracle
 */
public record ExtractionResult(
        Process process,
        ExtractionMethod method,
        double confidence,
        TemplateValidationResult validation,
        ReferenceStats referenceStats) {

    public ExtractionResult {
        if (process == null) {
            throw new IllegalArgumentException("process must not be null");
        }
        if (referenceStats == null) {
            referenceStats = ReferenceStats.empty();
        }
    }

    /**
     * Copy carrying the validation of an earlier template attempt.
     */
    public ExtractionResult withValidation(TemplateValidationResult templateValidation) {
        return new ExtractionResult(process, method, confidence, templateValidation, referenceStats);
    }
}
