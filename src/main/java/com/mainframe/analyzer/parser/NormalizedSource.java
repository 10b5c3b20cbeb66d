package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.SourceMetrics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NormalizedSource {

    @NonNull
    String fileName;

    /**
     * Format actually applied; never {@link SourceFormat#AUTO}.
     */
    @NonNull
    SourceFormat format;

    @Singular("line")
    List<NormalizedLine> lines;

    @NonNull
    SourceMetrics metrics;
}
