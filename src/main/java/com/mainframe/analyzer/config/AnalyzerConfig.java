package com.mainframe.analyzer.config;

import com.mainframe.analyzer.parser.SourceFormat;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.List;

/**
 * Settings for one analyzer run. Defaults apply to anything the config file and command line
 * leave unset.
 */
@Data
@Builder(toBuilder = true)
public class AnalyzerConfig {

    public static final int DEFAULT_MAX_DEPTH = 3;

    @Builder.Default
    private SourceFormat sourceFormat = SourceFormat.AUTO;

    @Builder.Default
    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private int defaultMaxDepth = DEFAULT_MAX_DEPTH;

    /**
     * Deadline for a single impact query; null means unbounded.
     */
    @Builder.Default
    private Duration queryTimeout = Duration.ofSeconds(30);

    /**
     * Analyze copybook sources found next to the programs.
     */
    @Builder.Default
    private boolean includeCopybookPrograms = true;

    @Builder.Default
    private List<String> sourceExtensions = List.of(".cbl", ".cob", ".cobol");

    @Builder.Default
    private List<String> copybookExtensions = List.of(".cpy", ".copy");

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }
}
