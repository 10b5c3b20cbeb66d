package com.mainframe.analyzer.impact;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class QueryOptions {

    public static final QueryOptions DEFAULTS = QueryOptions.builder().build();

    /**
     * Point in time after which traversal stops; null means no deadline.
     */
    Instant deadline;

    @Builder.Default
    boolean includeCascading = true;

    /**
     * On deadline expiry return what was found with {@code truncated} set instead of throwing.
     */
    @Builder.Default
    boolean bestEffort = true;
}
