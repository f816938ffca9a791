package org.laminar.template;

import org.laminar.template.models.ColumnMapping;
import org.laminar.template.models.ColumnType;
import org.laminar.template.models.TemplateValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The spreadsheet template: which columns a process sheet may have and how headers are
 * recognised.
 * <p>
 * Expected layout:
 * <pre>
 * | Step # | Role    | Step Title     | Description       | Next Step | Condition? | Yes→ | No→ | Notes    |
 * |--------|---------|----------------|-------------------|-----------|------------|------|-----|----------|
 * | 1      | Officer | Receive report | Get customer list | 2         |            |      |     |          |
 * | 2      |         | Data complete? | Verify all fields |           | Yes        | END  | 1   | Decision |
 * </pre>
 */
public class TemplateHelper {

    private static final Logger log = LoggerFactory.getLogger(TemplateHelper.class);

    public static final int MIN_MATCHED_COLUMNS = 3;
    public static final double REQUIRED_WEIGHT = 0.6;
    public static final double OVERALL_WEIGHT = 0.4;

    private static final String PLACEHOLDER_HEADER_PREFIX = "Unnamed";

    public static final List<ColumnMapping> TEMPLATE_COLUMNS = List.of(
            new ColumnMapping(ColumnType.STEP_NUMBER, true,
                    List.of("step #", "step", "step no", "step no.", "#", "no", "no.", "id", "step_id")),
            new ColumnMapping(ColumnType.ROLE, true,
                    List.of("role", "actor", "responsible", "owner", "assigned to", "performer", "swimlane")),
            new ColumnMapping(ColumnType.STEP_TITLE, true,
                    List.of("title", "step title", "name", "step name", "action", "activity", "task")),
            new ColumnMapping(ColumnType.DESCRIPTION, false,
                    List.of("description", "desc", "details", "step description", "explanation")),
            new ColumnMapping(ColumnType.NEXT_STEP, false,
                    List.of("next", "next step", "goes to", "then", "flow to", "->")),
            new ColumnMapping(ColumnType.IS_CONDITION, false,
                    List.of("condition", "is condition", "decision", "condition?", "is decision", "type")),
            new ColumnMapping(ColumnType.YES_NEXT, false,
                    List.of("yes", "yes next", "yes ->", "yes→", "if yes", "true", "yes path", "on yes")),
            new ColumnMapping(ColumnType.NO_NEXT, false,
                    List.of("no", "no next", "no ->", "no→", "if no", "false", "no path", "on no")),
            new ColumnMapping(ColumnType.YES_WHEN, false,
                    List.of("yes when", "yes condition", "yes if", "condition for yes")),
            new ColumnMapping(ColumnType.NO_WHEN, false,
                    List.of("no when", "no condition", "no if", "condition for no")),
            new ColumnMapping(ColumnType.NOTES, false,
                    List.of("notes", "note", "comments", "remarks", "annotations")),
            new ColumnMapping(ColumnType.MANUAL_SYSTEM, false,
                    List.of("manual/system", "manual or system", "type", "execution type", "mode")),
            new ColumnMapping(ColumnType.SYSTEM_NAME, false,
                    List.of("system", "system name", "application", "app", "tool")),
            new ColumnMapping(ColumnType.USER_ID, false,
                    List.of("user", "user id", "login", "username", "user name")),
            new ColumnMapping(ColumnType.PROGRAM_ID, false,
                    List.of("program", "program id", "t-code", "tcode", "screen", "transaction"))
    );

    /**
     * Matches headers against the template columns.
     * <p>
     * Blank and spreadsheet placeholder headers ({@code Unnamed: 3}) are skipped. The first column
     * definition that matches a header owns it; a header whose column type is already bound is
     * ignored, a header no definition matches is reported as unmatched.
     *
     * @param headers sheet headers in column order
     * @return the validation result, never null
     */
    public static TemplateValidationResult validateTemplate(List<String> headers) {
        Map<ColumnType, String> matched = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();
        List<String> ignored = new ArrayList<>();

        for (String rawHeader : headers) {
            String header = rawHeader == null ? "" : rawHeader.trim();
            if (header.isEmpty() || header.startsWith(PLACEHOLDER_HEADER_PREFIX)) {
                continue;
            }

            ColumnMapping owner = findColumn(header);
            if (owner == null) {
                unmatched.add(header);
            } else if (matched.containsKey(owner.columnType())) {
                ignored.add(header);
            } else {
                matched.put(owner.columnType(), header);
            }
        }

        List<ColumnType> missingRequired = TEMPLATE_COLUMNS.stream()
                .filter(ColumnMapping::required)
                .map(ColumnMapping::columnType)
                .filter(type -> !matched.containsKey(type))
                .collect(Collectors.toList());

        double confidence = confidence(matched.keySet().stream().toList());
        boolean valid = missingRequired.isEmpty() && matched.size() >= MIN_MATCHED_COLUMNS;

        List<String> messages = new ArrayList<>();
        if (!missingRequired.isEmpty()) {
            messages.add("Missing required columns: " + missingRequired.stream()
                    .map(ColumnType::tag)
                    .collect(Collectors.joining(", ")));
        }
        if (!unmatched.isEmpty()) {
            messages.add("Unrecognized columns (will be ignored): " + String.join(", ", unmatched));
        }
        if (!ignored.isEmpty()) {
            messages.add("Duplicate columns (will be ignored): " + String.join(", ", ignored));
        }
        if (!matched.isEmpty()) {
            messages.add("Matched " + matched.size() + " template columns");
        }

        log.debug("Template match: {} columns, confidence {}", matched.size(), confidence);
        return new TemplateValidationResult(valid, confidence, matched, missingRequired, unmatched, ignored, messages);
    }

    /**
     * Confidence for a set of bound column types:
     * {@code 0.6 * requiredMatched / requiredTotal + 0.4 * matched / total}.
     */
    public static double confidence(List<ColumnType> matchedTypes) {
        Map<ColumnType, Boolean> bound = new EnumMap<>(ColumnType.class);
        matchedTypes.forEach(type -> bound.put(type, Boolean.TRUE));

        long requiredTotal = TEMPLATE_COLUMNS.stream().filter(ColumnMapping::required).count();
        long requiredMatched = TEMPLATE_COLUMNS.stream()
                .filter(column -> column.required() && bound.containsKey(column.columnType()))
                .count();

        double requiredScore = requiredTotal > 0 ? (double) requiredMatched / requiredTotal : 1.0;
        double overallScore = (double) bound.size() / TEMPLATE_COLUMNS.size();
        return requiredScore * REQUIRED_WEIGHT + overallScore * OVERALL_WEIGHT;
    }

    public static ColumnMapping findColumn(String header) {
        for (ColumnMapping column : TEMPLATE_COLUMNS) {
            if (column.matches(header)) {
                return column;
            }
        }
        return null;
    }
}
