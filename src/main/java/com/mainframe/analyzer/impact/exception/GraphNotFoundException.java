package com.mainframe.analyzer.impact.exception;

/**
 * Thrown when a query needs a graph or node that does not exist.
 */
public class GraphNotFoundException extends RuntimeException {

    public GraphNotFoundException(String message) {
        super(message);
    }
}
