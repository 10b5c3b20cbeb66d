package com.mainframe.analyzer.lineage;

import com.mainframe.analyzer.model.StatementKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DataTransformation {

    @NonNull
    StatementKind operation;

    @Singular
    List<String> inputs;

    @Singular
    List<String> outputs;

    String formula;

    @NonNull
    Location location;
}
