package com.mainframe.analyzer.impact;

/**
 * How an impacted entity is reached from the changed one. The edge kind is kept separately on
 * {@link ImpactedItem#getEdgeType()}.
 */
public enum ChangeType {
    /** Depth 1. */
    DIRECT,
    /** Depth 2 or deeper, not a field. */
    INDIRECT,
    /** A field reached at depth 2 or deeper. */
    CASCADING;

    static ChangeType of(int depth, EntityRef entity) {
        if (depth <= 1) {
            return DIRECT;
        }
        return entity.getKind() == EntityKind.FIELD ? CASCADING : INDIRECT;
    }
}
