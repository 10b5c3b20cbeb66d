package com.mainframe.analyzer.impact;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class DependencyEdge {

    @NonNull
    EntityRef from;

    @NonNull
    EntityRef to;

    @NonNull
    EdgeType type;

    @NonNull
    @Builder.Default
    DependencyStrength strength = DependencyStrength.STRONG;

    int lineNumber;

    String paragraph;
}
