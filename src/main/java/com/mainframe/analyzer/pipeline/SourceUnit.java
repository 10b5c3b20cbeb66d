package com.mainframe.analyzer.pipeline;

import lombok.NonNull;
import lombok.Value;

/**
 * One source file handed to the pipeline; reading it from disk is the caller's job.
 */
@Value
public class SourceUnit {
    @NonNull
    String fileName;
    @NonNull
    String content;
}
