package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Physical line counts of one source file.
 */
@Value
@Builder
public class SourceMetrics {

    public static final SourceMetrics EMPTY = SourceMetrics.builder().build();

    int totalLines;
    int codeLines;
    int commentLines;
    int blankLines;
}
