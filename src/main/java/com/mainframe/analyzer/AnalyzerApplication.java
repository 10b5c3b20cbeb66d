package com.mainframe.analyzer;

import com.mainframe.analyzer.cli.AnalyzerCommand;

import picocli.CommandLine;

/**
 * Main entry point for the COBOL static analyzer.
 */
public class AnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
