package org.laminar.template;

import org.laminar.excel.SheetTable;
import org.laminar.process.StepIds;
import org.laminar.process.SystemStep;
import org.laminar.process.models.Process;
import org.laminar.process.models.Role;
import org.laminar.process.models.Step;
import org.laminar.template.models.ColumnType;
import org.laminar.template.models.TemplateValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a process directly from a sheet that follows the template, without the extraction oracle.
 * <p>
 * Rows are read twice. The first pass assigns every titled row its step id and registers the
 * ways other rows may refer to it (step number, its numeric form, lowercase title). The second
 * pass builds the steps and resolves their transition cells against that lookup table.
 */
public class TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    private static final String STEP_ID_PREFIX = "step_";
    private static final String NOTES_DELIMITER = ";";

    static final String SYSTEM_NAME_ATTRIBUTE = "system_name";

    private static final Set<String> CONDITION_MARKERS = Set.of("yes", "true", "1", "x", "condition", "decision");
    private static final Set<String> END_SYNONYMS = Set.of("end", "finish", "done", "complete");
    private static final Set<String> ABORT_SYNONYMS = Set.of("abort", "cancel", "fail", "error", "reject");
    private static final Set<String> START_SYNONYMS = Set.of("start", "begin");

    /**
     * Validates the sheet headers and, when the sheet passes the template gate, parses it.
     *
     * @param table the sheet to parse
     * @return validation, the parsed process (null if the gate failed) and reference statistics
     */
    public TemplateParseResult validateAndParse(SheetTable table) {
        TemplateValidationResult validation = TemplateHelper.validateTemplate(table.headers());

        if (!validation.canParseDirectly()) {
            log.info("Sheet '{}' is not template compliant (confidence: {}%): {}",
                    table.sheetName(), percent(validation.confidence()), String.join("; ", validation.messages()));
            return new TemplateParseResult(validation, null, ReferenceStats.empty());
        }

        ParseRun run = new ParseRun(validation, table);
        Process process = run.parse();
        ReferenceStats stats = new ReferenceStats(run.resolvedReferences, run.droppedReferences);

        log.info("Parsed sheet '{}' as template (confidence: {}%, {} steps, {} dropped references)",
                table.sheetName(), percent(validation.confidence()), process.processSteps().size(), stats.dropped());
        return new TemplateParseResult(validation, process, stats);
    }

    /**
     * Lowercases a role title and collapses every run of other characters into one underscore.
     *
     * @return the role id, or null if nothing alphanumeric is left
     */
    public static String toRoleId(String roleTitle) {
        if (roleTitle == null) {
            return null;
        }
        String roleId = roleTitle.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return roleId.isEmpty() ? null : roleId;
    }

    public static String toProcessId(String processName) {
        return processName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }

    /**
     * "1.0" and "1" are the same step number. Non numeric text is returned unchanged.
     */
    static String canonicalNumber(String number) {
        try {
            return new BigDecimal(number).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return number;
        }
    }

    private static String percent(double confidence) {
        return String.format(Locale.ROOT, "%.1f", confidence * 100);
    }

    /**
     * State of parsing one sheet.
     */
    private static final class ParseRun {

        private final TemplateValidationResult validation;
        private final SheetTable table;
        private final Map<String, String> stepIdLookup = new HashMap<>();
        private final List<String> droppedReferences = new ArrayList<>();
        private int resolvedReferences;

        private ParseRun(TemplateValidationResult validation, SheetTable table) {
            this.validation = validation;
            this.table = table;
        }

        private Process parse() {
            List<Map<String, String>> rows = table.rows();

            for (int index = 0; index < rows.size(); index++) {
                Map<String, String> row = rows.get(index);
                String title = cell(row, ColumnType.STEP_TITLE);
                if (title.isEmpty()) {
                    continue;
                }
                String stepId = stepId(row, index);
                String number = cell(row, ColumnType.STEP_NUMBER);
                if (!number.isEmpty()) {
                    stepIdLookup.put(number, stepId);
                    stepIdLookup.put(canonicalNumber(number), stepId);
                }
                stepIdLookup.put(title.toLowerCase(Locale.ROOT), stepId);
            }

            Map<String, Role> roles = new LinkedHashMap<>();
            List<Step> steps = new ArrayList<>();
            for (int index = 0; index < rows.size(); index++) {
                Map<String, String> row = rows.get(index);
                String roleId = toRoleId(cell(row, ColumnType.ROLE));
                if (roleId != null && !roles.containsKey(roleId)) {
                    roles.put(roleId, new Role(roleId, cell(row, ColumnType.ROLE)));
                }
                if (!cell(row, ColumnType.STEP_TITLE).isEmpty()) {
                    steps.add(buildStep(row, index, roleId));
                }
            }

            String processName = table.sheetName();
            return new Process(
                    toProcessId(processName),
                    processName,
                    new ArrayList<>(roles.values()),
                    SystemStepSynthesizer.ensureSystemSteps(steps));
        }

        private Step buildStep(Map<String, String> row, int index, String roleId) {
            String title = cell(row, ColumnType.STEP_TITLE);
            boolean condition = isCondition(row);

            Map<String, Object> additionalAttributes = new LinkedHashMap<>();
            String systemName = cell(row, ColumnType.SYSTEM_NAME);
            if (!systemName.isEmpty()) {
                additionalAttributes.put(SYSTEM_NAME_ATTRIBUTE, systemName);
            }

            Step.StepBuilder builder = Step.builder()
                    .stepId(stepId(row, index))
                    .stepRole(roleId)
                    .stepTitle(title)
                    .stepDescription(emptyToNull(cell(row, ColumnType.DESCRIPTION)))
                    .stepNotes(notes(cell(row, ColumnType.NOTES)))
                    .manualSystem(emptyToNull(cell(row, ColumnType.MANUAL_SYSTEM)))
                    .userCredentials(emptyToNull(cell(row, ColumnType.USER_ID)))
                    .programLocation(emptyToNull(cell(row, ColumnType.PROGRAM_ID)))
                    .yesWhen(emptyToNull(cell(row, ColumnType.YES_WHEN)))
                    .noWhen(emptyToNull(cell(row, ColumnType.NO_WHEN)))
                    .additionalAttributes(additionalAttributes);

            if (condition) {
                builder.nextStepYes(resolve(cell(row, ColumnType.YES_NEXT), title))
                        .nextStepNo(resolve(cell(row, ColumnType.NO_NEXT), title));
            } else {
                builder.nextStep(resolve(cell(row, ColumnType.NEXT_STEP), title));
            }
            return builder.build();
        }

        /**
         * The final id of a row's step: {@code step_<number>} or {@code step_<row index>}, and
         * {@code CONDITION::<number>} for decision rows.
         */
        private String stepId(Map<String, String> row, int index) {
            String number = cell(row, ColumnType.STEP_NUMBER);
            String stepId = STEP_ID_PREFIX + (number.isEmpty() ? String.valueOf(index) : canonicalNumber(number));
            if (isCondition(row)) {
                return StepIds.condition(stepId.substring(STEP_ID_PREFIX.length()));
            }
            return stepId;
        }

        private boolean isCondition(Map<String, String> row) {
            String marker = cell(row, ColumnType.IS_CONDITION).toLowerCase(Locale.ROOT);
            if (CONDITION_MARKERS.contains(marker)) {
                return true;
            }
            if (!cell(row, ColumnType.YES_NEXT).isEmpty() || !cell(row, ColumnType.NO_NEXT).isEmpty()) {
                return true;
            }
            return cell(row, ColumnType.STEP_TITLE).endsWith("?");
        }

        /**
         * Resolves a transition cell to a step id. Unresolvable references are counted, logged
         * and produce no edge.
         */
        private String resolve(String reference, String rowTitle) {
            if (reference.isEmpty()) {
                return null;
            }
            String resolved = lookup(reference);
            if (resolved == null) {
                droppedReferences.add(rowTitle + " -> " + reference);
                log.warn("Sheet '{}': step '{}' references unknown step '{}', transition dropped",
                        table.sheetName(), rowTitle, reference);
            } else {
                resolvedReferences++;
            }
            return resolved;
        }

        private String lookup(String reference) {
            String lower = reference.trim().toLowerCase(Locale.ROOT);
            if (END_SYNONYMS.contains(lower)) {
                return SystemStep.END.id();
            }
            if (ABORT_SYNONYMS.contains(lower)) {
                return SystemStep.ABORT.id();
            }
            if (START_SYNONYMS.contains(lower)) {
                return SystemStep.START.id();
            }
            if (stepIdLookup.containsKey(reference)) {
                return stepIdLookup.get(reference);
            }
            if (stepIdLookup.containsKey(lower)) {
                return stepIdLookup.get(lower);
            }
            String number = canonicalNumber(lower);
            if (stepIdLookup.containsKey(number)) {
                return stepIdLookup.get(number);
            }
            if (lower.matches("\\d+")) {
                return STEP_ID_PREFIX + lower;
            }
            return null;
        }

        private String cell(Map<String, String> row, ColumnType columnType) {
            return SheetTable.cell(row, validation.headerFor(columnType));
        }

        private static List<String> notes(String notesCell) {
            if (notesCell.isEmpty()) {
                return List.of();
            }
            return Arrays.stream(notesCell.split(NOTES_DELIMITER))
                    .map(String::trim)
                    .filter(note -> !note.isEmpty())
                    .toList();
        }

        private static String emptyToNull(String value) {
            return value.isEmpty() ? null : value;
        }
    }
}
