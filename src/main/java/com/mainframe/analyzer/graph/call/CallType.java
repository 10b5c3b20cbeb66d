package com.mainframe.analyzer.graph.call;

public enum CallType {
    /**
     * CALL 'LITERAL'.
     */
    STATIC,

    /**
     * CALL identifier.
     */
    DYNAMIC
}
