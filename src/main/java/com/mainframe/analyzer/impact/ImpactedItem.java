package com.mainframe.analyzer.impact;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ImpactedItem {

    @NonNull
    EntityRef entity;

    /**
     * BFS level from the changed entity, starting at 1.
     */
    int depth;

    @NonNull
    Severity severity;

    /**
     * Human readable relation to the entity it was reached from, e.g. "calls PAYROLL".
     */
    @NonNull
    String relationship;

    @NonNull
    ChangeType changeType;

    @NonNull
    EntityRef via;

    @NonNull
    EdgeType edgeType;

    int lineNumber;
}
