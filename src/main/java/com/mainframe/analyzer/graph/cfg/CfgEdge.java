package com.mainframe.analyzer.graph.cfg;

import lombok.NonNull;
import lombok.Value;

@Value
public class CfgEdge {
    @NonNull
    String from;
    @NonNull
    String to;
    @NonNull
    CfgEdgeType type;
    int lineNumber;
    /**
     * False when {@code to} names no paragraph or section of the program.
     */
    boolean resolved;
}
