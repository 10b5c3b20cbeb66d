package com.mainframe.analyzer.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing on its own but print usage.
 */
@Command(
        name = "cobol-analyzer",
        mixinStandardHelpOptions = true,
        version = "cobol-static-analyzer 1.0.0",
        description = "Static analysis of COBOL programs: structure, control flow, calls, data lineage, "
                + "business rule candidates and change impact.",
        subcommands = {AnalyzeCommand.class, ImpactCommand.class, CommandLine.HelpCommand.class}
)
public class AnalyzerCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
