package com.mainframe.analyzer.cli;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.io.SourceLoader;
import com.mainframe.analyzer.cli.model.ImpactOptions;
import com.mainframe.analyzer.cli.model.SourceOptions;
import com.mainframe.analyzer.cli.model.ValidatedOptions;
import com.mainframe.analyzer.cli.output.AnalysisResultsPrinter;
import com.mainframe.analyzer.cli.validation.OptionsValidator;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.impact.ImpactAnalysisEngine;
import com.mainframe.analyzer.impact.ImpactReport;
import com.mainframe.analyzer.impact.QueryOptions;
import com.mainframe.analyzer.impact.exception.AnalysisTimeoutException;
import com.mainframe.analyzer.pipeline.AnalysisPipeline;
import com.mainframe.analyzer.pipeline.SourceUnit;
import com.mainframe.analyzer.report.AnalysisJsonWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command that analyzes a directory and reports what a change to one entity affects.
 */
@Command(
        name = "impact",
        mixinStandardHelpOptions = true,
        description = "Reports programs, copybooks, fields and files affected by changing one entity."
)
public class ImpactCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImpactCommand.class);

    @Mixin
    private SourceOptions sourceOptions = new SourceOptions();

    @Mixin
    private ImpactOptions impactOptions = new ImpactOptions();

    private final OptionsValidator validator = new OptionsValidator();
    private final AnalysisResultsPrinter printer = new AnalysisResultsPrinter();

    @Override
    public Integer call() {
        ValidatedOptions v;
        try {
            v = validator.validate(sourceOptions, impactOptions);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return OptionsValidationException.EXIT_CODE;
        }

        try {
            printer.printBanner("impact", v);
            AnalyzerConfig config = v.getConfig();
            List<SourceUnit> sources = new SourceLoader(config).load(v.getNormalizedSourceDir());
            AnalysisPipeline pipeline = new AnalysisPipeline(config);
            pipeline.analyze(sources);
            ImpactAnalysisEngine engine = new ImpactAnalysisEngine(pipeline.getStore());

            if (impactOptions.isInstant()) {
                printer.printInstant(engine.getInstantImpact(impactOptions.getKind(), impactOptions.getId()));
                return 0;
            }

            int depth = impactOptions.getMaxDepth() != null ? impactOptions.getMaxDepth() : config.getDefaultMaxDepth();
            QueryOptions query = QueryOptions.builder()
                    .deadline(config.getQueryTimeout() == null ? null : Instant.now().plus(config.getQueryTimeout()))
                    .build();
            ImpactReport report = engine.analyzeImpact(impactOptions.getKind(), impactOptions.getId(), depth, query);
            printer.printImpact(report);
            if (impactOptions.isFieldDetail()) {
                printer.printFieldImpact(engine.analyzeFieldImpact(impactOptions.getId()));
            }
            if (impactOptions.getJsonOutput() != null) {
                new AnalysisJsonWriter().write(report, impactOptions.getJsonOutput());
            }
            return report.isFound() ? 0 : 3;
        } catch (AnalysisTimeoutException e) {
            log.error("Impact query timed out after {} items", e.getItemsVisited());
            return 1;
        } catch (Exception e) {
            log.error("Impact analysis failed with exception", e);
            return 1;
        }
    }
}
