package com.mainframe.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated while analyzing one source file.
 *
 * Pure structure only: no logging, no formatting, no IO. Append-only and written by one thread at a
 * time: the worker that owns the file, then the cross-program stages of a batch, which work on their
 * own {@link #copy()}.
 */
public class AnalysisDiagnostics {

    @JsonIgnore
    private final String fileName;

    @Getter
    private final List<Diagnostic> errors = new ArrayList<>();

    @Getter
    private final List<Diagnostic> warnings = new ArrayList<>();

    @Getter
    private final List<Diagnostic> infos = new ArrayList<>();

    public AnalysisDiagnostics(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Independent instance holding the same diagnostics.
     */
    public AnalysisDiagnostics copy() {
        AnalysisDiagnostics copy = new AnalysisDiagnostics(fileName);
        copy.errors.addAll(errors);
        copy.warnings.addAll(warnings);
        copy.infos.addAll(infos);
        return copy;
    }

    public void add(DiagnosticKind kind, int lineNumber, String message) {
        Diagnostic diagnostic = Diagnostic.builder()
                .kind(kind)
                .message(message)
                .fileName(fileName)
                .lineNumber(lineNumber)
                .build();
        List<Diagnostic> target = switch (kind.getSeverity()) {
            case ERROR -> errors;
            case WARNING -> warnings;
            default -> infos;
        };
        if (!target.contains(diagnostic)) {
            target.add(diagnostic);
        }
    }

    public void warn(DiagnosticKind kind, int lineNumber, String message) {
        add(kind, lineNumber, message);
    }

    public void error(int lineNumber, String message) {
        add(DiagnosticKind.ANALYSIS_ERROR, lineNumber, message);
    }

    public void info(String message) {
        add(DiagnosticKind.INFO, 0, message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Warnings of one kind, in insertion order.
     */
    public List<Diagnostic> warningsOf(DiagnosticKind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic warning : warnings) {
            if (warning.getKind() == kind) {
                result.add(warning);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
