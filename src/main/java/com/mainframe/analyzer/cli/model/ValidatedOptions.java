package com.mainframe.analyzer.cli.model;

import com.mainframe.analyzer.config.AnalyzerConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Derived values needed by the commands: normalized paths and the effective configuration.
 */
@Data
@AllArgsConstructor
public class ValidatedOptions {
    Path normalizedSourceDir;
    Path normalizedOutputDir;
    AnalyzerConfig config;
}
