package com.mainframe.analyzer.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Getter
public class AnalyzeOptions {

    @Option(names = {"--output-dir", "-o"}, description = "Directory for analysis.json and analysis-summary.md")
    private Path outputDir;

    @Option(names = {"--no-json"}, description = "Do not write analysis.json")
    private boolean skipJson;

    @Option(names = {"--no-summary"}, description = "Do not write the Markdown summary")
    private boolean skipSummary;
}
