package com.mainframe.analyzer.model;

public enum ProgramKind {
    /**
     * Source with a PROCEDURE DIVISION or an IDENTIFICATION DIVISION.
     */
    PROGRAM,

    /**
     * Source made only of data entries, analyzed as a member included through COPY.
     */
    COPYBOOK
}
