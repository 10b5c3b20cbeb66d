package com.mainframe.analyzer.model;

/**
 * Storage category inferred for a data item from its PICTURE and USAGE clauses.
 */
public enum DataType {
    ALPHANUMERIC("ALPHANUMERIC"),
    NUMERIC("NUMERIC"),
    SIGNED_NUMERIC("SIGNED_NUMERIC"),
    DECIMAL("DECIMAL"),
    COMP("COMP"),
    COMP_3("COMP-3"),
    BINARY("BINARY");

    private final String cobolName;

    DataType(String cobolName) {
        this.cobolName = cobolName;
    }

    public String getCobolName() {
        return cobolName;
    }

    public boolean isNumericFamily() {
        return this != ALPHANUMERIC;
    }
}
