package com.mainframe.analyzer.cli;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.io.SourceLoader;
import com.mainframe.analyzer.cli.model.AnalyzeOptions;
import com.mainframe.analyzer.cli.model.SourceOptions;
import com.mainframe.analyzer.cli.model.ValidatedOptions;
import com.mainframe.analyzer.cli.output.AnalysisResultsPrinter;
import com.mainframe.analyzer.cli.validation.OptionsValidator;
import com.mainframe.analyzer.pipeline.AnalysisPipeline;
import com.mainframe.analyzer.pipeline.BatchAnalysis;
import com.mainframe.analyzer.pipeline.SourceUnit;
import com.mainframe.analyzer.report.AnalysisJsonWriter;
import com.mainframe.analyzer.report.SummaryReportGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command that analyzes a directory of COBOL sources and writes the results.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        description = "Analyzes every program and copybook below a directory."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final String JSON_FILE = "analysis.json";
    static final String SUMMARY_FILE = "analysis-summary.md";

    @Mixin
    private SourceOptions sourceOptions = new SourceOptions();

    @Mixin
    private AnalyzeOptions analyzeOptions = new AnalyzeOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final AnalysisResultsPrinter printer = new AnalysisResultsPrinter();

    @Override
    public Integer call() {
        ValidatedOptions v;
        try {
            v = validator.validate(sourceOptions, analyzeOptions);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return OptionsValidationException.EXIT_CODE;
        }

        try {
            printer.printBanner("analyze", v);
            List<SourceUnit> sources = new SourceLoader(v.getConfig()).load(v.getNormalizedSourceDir());
            if (sources.isEmpty()) {
                log.error("No COBOL sources found in {}", v.getNormalizedSourceDir());
                return 1;
            }

            BatchAnalysis batch = new AnalysisPipeline(v.getConfig()).analyze(sources);
            printer.printSummary(batch);

            if (!analyzeOptions.isSkipJson()) {
                new AnalysisJsonWriter().write(batch, v.getNormalizedOutputDir().resolve(JSON_FILE));
            }
            if (!analyzeOptions.isSkipSummary()) {
                new SummaryReportGenerator().write(batch, v.getNormalizedOutputDir().resolve(SUMMARY_FILE));
            }
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed with exception", e);
            return 1;
        }
    }
}
