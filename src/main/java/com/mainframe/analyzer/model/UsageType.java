package com.mainframe.analyzer.model;

/**
 * COBOL USAGE clause types.
 */
public enum UsageType {
    /**
     * Default display format (character or zoned decimal).
     */
    DISPLAY,

    /**
     * Binary format declared as COMP, COMP-4 or COMPUTATIONAL.
     */
    COMP,

    /**
     * Binary format declared as BINARY.
     */
    BINARY,

    /**
     * Packed decimal format (COMP-3).
     */
    PACKED_DECIMAL,

    /**
     * Native binary (COMP-5).
     */
    COMP_5,

    /**
     * Floating point single precision (COMP-1).
     */
    COMP_1,

    /**
     * Floating point double precision (COMP-2).
     */
    COMP_2,

    INDEX,

    POINTER;

    public static UsageType fromCobol(String usage) {
        if (usage == null) {
            return DISPLAY;
        }
        String normalized = usage.toUpperCase().trim();
        return switch (normalized) {
            case "COMP", "COMP-4", "COMPUTATIONAL", "COMPUTATIONAL-4" -> COMP;
            case "BINARY" -> BINARY;
            case "COMP-3", "COMPUTATIONAL-3", "PACKED-DECIMAL" -> PACKED_DECIMAL;
            case "COMP-5", "COMPUTATIONAL-5" -> COMP_5;
            case "COMP-1", "COMPUTATIONAL-1" -> COMP_1;
            case "COMP-2", "COMPUTATIONAL-2" -> COMP_2;
            case "INDEX" -> INDEX;
            case "POINTER" -> POINTER;
            default -> DISPLAY;
        };
    }

    /**
     * True when the keyword names a usage (so the parser can accept it without a leading USAGE).
     */
    public static boolean isUsageKeyword(String word) {
        if (word == null) {
            return false;
        }
        return switch (word.toUpperCase()) {
            case "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
                 "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
                 "COMPUTATIONAL-4", "COMPUTATIONAL-5", "BINARY", "PACKED-DECIMAL",
                 "DISPLAY", "INDEX", "POINTER" -> true;
            default -> false;
        };
    }
}
