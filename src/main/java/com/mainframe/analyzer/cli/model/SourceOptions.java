package com.mainframe.analyzer.cli.model;

import com.mainframe.analyzer.parser.SourceFormat;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that analyzes a source directory. No validation, no
 * execution logic.
 */
@Getter
public class SourceOptions {

    @Option(names = {"--source-dir", "-s"}, required = true,
            description = "Directory containing COBOL programs and copybooks (searched recursively)")
    private Path sourceDir;

    @Option(names = {"--config", "-c"},
            description = "Analyzer configuration file (default: ./cobol-analyzer.yml when present)")
    private Path configFile;

    @Option(names = {"--format"}, description = "Source format: FIXED, FREE or AUTO (overrides the config file)")
    private SourceFormat sourceFormat;

    @Option(names = {"--parallelism", "-j"}, description = "Number of parser workers (overrides the config file)")
    private Integer parallelism;
}
