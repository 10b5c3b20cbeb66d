package com.mainframe.analyzer.impact;

public enum EdgeType {
    /** program to called program */
    CALLS,
    /** program to copybook */
    INCLUDES,
    /** copybook or program to field, program to paragraph */
    DEFINES,
    FILE_IO,
    /** program to SQL table */
    DATABASE,
    /** field to field */
    DATA_FLOW,
    /** program to field */
    USES_FIELD
}
