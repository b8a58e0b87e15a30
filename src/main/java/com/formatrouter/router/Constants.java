package com.formatrouter.router;

/**
 * Cost constants shared by the rule families.
 */
public final class Constants {
    /** Cost of a newline candidate that only a forcing policy should select. */
    public static final int SHOULD_BE_NEWLINE = 100000;
    public static final int SHOULD_BE_SINGLE_LINE = 30;
    public static final int BIN_PACK_ASSIGNMENT_PENALTY = 10;
    public static final int SPARK_COLON_NEWLINE = 10;
    public static final int BRACKET_PENALTY = 20;
    public static final int EXCEED_COLUMN_PENALTY = 1000;
    public static final int BREAK_SINGLE_LINE_INTERPOLATED_STRING = 10000;
    public static final int INDENT_FOR_WITH_CHAINS = 2;

    private Constants() {
    }
}
