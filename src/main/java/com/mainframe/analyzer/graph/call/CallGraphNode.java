package com.mainframe.analyzer.graph.call;

import lombok.NonNull;
import lombok.Value;

@Value
public class CallGraphNode {
    @NonNull
    String id;
    @NonNull
    CallNodeType type;
    /**
     * Source file of an analyzed program, null for external targets.
     */
    String fileName;
}
