package com.mainframe.analyzer.impact;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one impact query. Items are ordered by depth, then entity kind, then id.
 */
@Value
@Builder
public class ImpactReport {

    @NonNull
    ImpactStatus status;

    @NonNull
    EntityRef source;

    @Singular("directItem")
    List<ImpactedItem> direct;

    @Singular("indirectItem")
    List<ImpactedItem> indirect;

    /**
     * Field-level propagation past the first level, only when the query includes it.
     */
    @Singular("cascadingItem")
    List<ImpactedItem> cascading;

    @NonNull
    RippleEffect rippleEffect;

    @NonNull
    ImpactMetrics metrics;

    boolean truncated;

    long graphVersion;

    public static ImpactReport notFound(EntityRef source, long graphVersion) {
        return ImpactReport.builder()
                .status(ImpactStatus.NOT_FOUND)
                .source(source)
                .rippleEffect(RippleEffect.of(List.of()))
                .metrics(ImpactMetrics.NONE)
                .graphVersion(graphVersion)
                .build();
    }

    @JsonIgnore
    public boolean isFound() {
        return status == ImpactStatus.OK;
    }

    /**
     * Direct, indirect and cascading items in report order.
     */
    @JsonIgnore
    public List<ImpactedItem> getImpactedItems() {
        List<ImpactedItem> all = new ArrayList<>(direct);
        all.addAll(indirect);
        all.addAll(cascading);
        all.sort(ImpactAnalysisEngine.ITEM_ORDER);
        return all;
    }
}
