package org.laminar.template.models;

/**
 * Semantic column types of the spreadsheet template.
 */
public enum ColumnType {
    STEP_NUMBER("step_number"),
    ROLE("role"),
    STEP_TITLE("step_title"),
    DESCRIPTION("description"),
    NEXT_STEP("next_step"),
    IS_CONDITION("is_condition"),
    YES_NEXT("yes_next"),
    NO_NEXT("no_next"),
    YES_WHEN("yes_when"),
    NO_WHEN("no_when"),
    NOTES("notes"),
    MANUAL_SYSTEM("manual_system"),
    SYSTEM_NAME("system_name"),
    USER_ID("user_id"),
    PROGRAM_ID("program_id");

    private final String tag;

    ColumnType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
