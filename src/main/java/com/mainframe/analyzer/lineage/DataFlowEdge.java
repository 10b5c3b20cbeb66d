package com.mainframe.analyzer.lineage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Value of {@code sourceField} reaches {@code targetField} through one statement.
 */
@Value
@Builder
public class DataFlowEdge {

    @NonNull
    String sourceField;

    @NonNull
    String targetField;

    @NonNull
    TransformationKind transformation;

    @NonNull
    Location location;

    /**
     * Enclosing IF / EVALUATE predicates, outermost first.
     */
    @Singular
    List<String> conditions;
}
