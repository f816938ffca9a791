package org.laminar.extraction;

import org.laminar.template.models.TemplateValidationResult;

import java.util.Locale;

/**
 * The sheet does not follow the template closely enough to be parsed directly.
 */
public class TemplateMismatchException extends ProcessExtractionException {

    private final TemplateValidationResult validation;

    public TemplateMismatchException(String sheetName, TemplateValidationResult validation) {
        super("Sheet '" + sheetName + "' does not match the template (confidence "
                + String.format(Locale.ROOT, "%.2f", validation.confidence()) + "): "
                + String.join("; ", validation.messages()));
        this.validation = validation;
    }

    public TemplateValidationResult getValidation() {
        return validation;
    }
}
