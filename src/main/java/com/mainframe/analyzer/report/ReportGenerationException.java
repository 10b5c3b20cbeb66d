package com.mainframe.analyzer.report;

public class ReportGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
