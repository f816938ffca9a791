package org.laminar.mermaid;

import org.laminar.process.models.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds node and edge labels that are safe inside a quoted Mermaid label.
 */
public class MermaidLabelHelper {

    public static final String LINE_BREAK = "<br/>";
    public static final int MAX_CONDITION_LENGTH = 30;
    private static final String ELLIPSIS = "...";
    private static final String MANUAL = "MANUAL";

    /**
     * Strips emphasis and comment markers ({@code *}, {@code #}), writes {@code &} as "and",
     * drops angle brackets and turns double quotes into single quotes.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("*", "")
                .replace("#", "")
                .replace("&", "and")
                .replace("<", "")
                .replace(">", "")
                .replace('"', '\'');
    }

    /**
     * Swimlane title for {@code subgraph id [title]}. Square brackets end the title, they are
     * written as parentheses.
     */
    public static String subgraphTitle(String roleTitle) {
        return sanitize(roleTitle)
                .replace('[', '(')
                .replace(']', ')');
    }

    /**
     * The title of a step followed by one line per metadata field that is set:
     * execution mode, login, password and location.
     */
    public static String stepLabel(Step step) {
        List<String> lines = new ArrayList<>();
        lines.add(sanitize(step.stepTitle()));
        if (isSet(step.manualSystem())) {
            lines.add(MANUAL.equals(step.manualSystem().trim().toUpperCase(Locale.ROOT))
                    ? MANUAL
                    : "SYSTEM " + sanitize(step.manualSystem()));
        }
        if (isSet(step.userCredentials())) {
            lines.add("LOGIN " + sanitize(step.userCredentials()));
        }
        if (isSet(step.passwordInfo())) {
            lines.add("PASSWORD " + sanitize(step.passwordInfo()));
        }
        if (isSet(step.programLocation())) {
            lines.add("LOCATION " + sanitize(step.programLocation()));
        }
        return String.join(LINE_BREAK, lines);
    }

    /**
     * Label of a yes/no edge: the qualifying condition cut to {@value #MAX_CONDITION_LENGTH}
     * characters, or the fallback word when the step has none.
     */
    public static String conditionLabel(String condition, String fallback) {
        if (!isSet(condition)) {
            return fallback;
        }
        String text = condition.trim();
        if (text.length() > MAX_CONDITION_LENGTH) {
            text = text.substring(0, MAX_CONDITION_LENGTH) + ELLIPSIS;
        }
        return sanitize(text);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
