package com.mainframe.analyzer.parser;

/**
 * Reference format of a COBOL source file.
 */
public enum SourceFormat {
    /**
     * Columns 1-6 sequence area, column 7 indicator, columns 8-72 program text.
     */
    FIXED,

    /**
     * Free-form text with {@code *>} inline comments.
     */
    FREE,

    /**
     * Decide per file from the shape of its lines.
     */
    AUTO
}
