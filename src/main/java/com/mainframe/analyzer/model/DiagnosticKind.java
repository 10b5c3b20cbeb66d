package com.mainframe.analyzer.model;

public enum DiagnosticKind {
    STRUCTURAL_PARSE_WARNING(Severity.WARNING),
    UNRESOLVED_REFERENCE_WARNING(Severity.WARNING),
    MALFORMED_DATA_ITEM_WARNING(Severity.WARNING),
    ANALYSIS_ERROR(Severity.ERROR),
    INFO(Severity.INFO);

    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
