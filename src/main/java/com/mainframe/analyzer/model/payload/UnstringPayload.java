package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class UnstringPayload implements StatementPayload {

    String source;

    @Singular("target")
    List<String> targets;

    String delimiter;
}
