package com.mainframe.analyzer.parser;

/**
 * Raised inside the data entry parser when an entry cannot be read; callers convert it into a
 * diagnostic and move on to the next entry.
 */
public class ParseException extends RuntimeException {

    private final int lineNumber;

    public ParseException(String message, int lineNumber) {
        super(message + " at line " + lineNumber);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
