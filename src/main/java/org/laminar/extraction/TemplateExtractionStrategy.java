package org.laminar.extraction;

import org.laminar.excel.SheetTable;
import org.laminar.template.TemplateParseResult;
import org.laminar.template.TemplateParser;

public class TemplateExtractionStrategy implements ExtractionStrategy {

    private final TemplateParser parser;

    public TemplateExtractionStrategy() {
        this(new TemplateParser());
    }

    public TemplateExtractionStrategy(TemplateParser parser) {
        this.parser = parser;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.TEMPLATE;
    }

    /**
     * @throws TemplateMismatchException if the sheet does not pass the template gate
     */
    @Override
    public ExtractionResult extract(SheetTable table) throws TemplateMismatchException {
        TemplateParseResult parsed = parser.validateAndParse(table);
        if (!parsed.hasProcess()) {
            throw new TemplateMismatchException(table.sheetName(), parsed.validation());
        }
        return new ExtractionResult(
                parsed.process(),
                ExtractionMethod.TEMPLATE,
                parsed.validation().confidence(),
                parsed.validation(),
                parsed.referenceStats());
    }
}
