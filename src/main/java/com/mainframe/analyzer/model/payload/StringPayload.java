package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StringPayload implements StatementPayload {

    @Singular("source")
    List<String> sources;

    String target;

    String delimiter;

    String pointer;
}
