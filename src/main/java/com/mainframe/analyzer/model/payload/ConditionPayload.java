package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * IF / EVALUATE / WHEN predicates.
 */
@Value
@Builder
public class ConditionPayload implements StatementPayload {

    /**
     * Simple conditions split on AND / OR, in source order.
     */
    @Singular("condition")
    List<String> conditions;

    @NonNull
    @Builder.Default
    LogicalOperator operator = LogicalOperator.AND;

    /**
     * EVALUATE subject, or the subject a WHEN belongs to when known.
     */
    String subject;

    /**
     * Inline action following the predicate on the same statement, e.g. the MOVE in
     * {@code IF A > B MOVE A TO C}.
     */
    String truthPath;
}
