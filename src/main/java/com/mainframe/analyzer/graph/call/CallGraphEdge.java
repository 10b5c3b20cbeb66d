package com.mainframe.analyzer.graph.call;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CallGraphEdge {

    @NonNull
    String from;

    @NonNull
    String to;

    @NonNull
    CallType callType;

    /**
     * USING arguments in order.
     */
    @Singular
    List<String> parameters;

    String paragraph;

    int lineNumber;

    /**
     * For a dynamic call, the identifier that held the target name.
     */
    String targetVariable;
}
