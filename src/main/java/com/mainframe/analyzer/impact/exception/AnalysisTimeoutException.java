package com.mainframe.analyzer.impact.exception;

import lombok.Getter;

/**
 * Thrown when an impact query passes its deadline and the caller did not ask for best-effort
 * results.
 */
@Getter
public class AnalysisTimeoutException extends RuntimeException {

    private final int itemsVisited;

    public AnalysisTimeoutException(String message, int itemsVisited) {
        super(message);
        this.itemsVisited = itemsVisited;
    }
}
