package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.lineage.Reference;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FieldImpactAnalysis {

    @NonNull
    String fieldName;

    /**
     * Every reference site of the field, across the batch.
     */
    @Singular
    List<Reference> usages;

    /**
     * Field chains the value flows through, each starting with {@code fieldName}.
     */
    @Singular
    List<List<String>> propagationChains;

    /**
     * Copybooks and programs declaring the field.
     */
    @Singular("definer")
    List<String> definedIn;

    @Singular
    List<String> affectedPrograms;
}
