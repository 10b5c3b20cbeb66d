package com.mainframe.analyzer.lineage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DataLineage {

    @NonNull
    String programId;

    @Singular
    List<DataFlowEdge> flows;

    @Singular
    List<DataTransformation> transformations;

    @Singular
    List<DataSource> sources;

    @Singular
    List<DataSink> sinks;
}
