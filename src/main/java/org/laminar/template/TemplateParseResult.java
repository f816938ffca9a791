package org.laminar.template;

import org.laminar.process.models.Process;
import org.laminar.template.models.TemplateValidationResult;

/**
 * Result of {@link TemplateParser#validateAndParse}. The process is null when the sheet does not
 * pass the template gate.
 */
public record TemplateParseResult(
        TemplateValidationResult validation,
        Process process,
        ReferenceStats referenceStats) {

    public boolean hasProcess() {
        return process != null;
    }
}
