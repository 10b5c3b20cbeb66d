package com.mainframe.analyzer.cli.validation;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.model.AnalyzeOptions;
import com.mainframe.analyzer.cli.model.ImpactOptions;
import com.mainframe.analyzer.cli.model.SourceOptions;
import com.mainframe.analyzer.cli.model.ValidatedOptions;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.config.AnalyzerConfigLoader;
import com.mainframe.analyzer.impact.EntityKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the command line and merges it over the configuration file. All problems are reported
 * together in one {@link OptionsValidationException}.
 */
public class OptionsValidator {

    private final AnalyzerConfigLoader configLoader;

    public OptionsValidator() {
        this(new AnalyzerConfigLoader());
    }

    public OptionsValidator(AnalyzerConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public ValidatedOptions validate(SourceOptions source, AnalyzeOptions analyze) {
        List<String> errors = new ArrayList<>();
        AnalyzerConfig config = validateSource(source, errors);
        Path outputDir = analyze.getOutputDir() == null ? Path.of(".") : analyze.getOutputDir();
        if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            errors.add("Output path exists and is not a directory: " + outputDir);
        }
        throwIfAny("analyze", errors);
        return new ValidatedOptions(normalize(source.getSourceDir()), normalize(outputDir), config);
    }

    public ValidatedOptions validate(SourceOptions source, ImpactOptions impact) {
        List<String> errors = new ArrayList<>();
        AnalyzerConfig config = validateSource(source, errors);
        if (isBlank(impact.getId())) {
            errors.add("Entity id is required (--id / -i).");
        }
        if (impact.getMaxDepth() != null && impact.getMaxDepth() < 0) {
            errors.add("Max depth must be >= 0. Got: " + impact.getMaxDepth());
        }
        if (impact.getTimeoutMillis() != null) {
            if (impact.getTimeoutMillis() <= 0) {
                errors.add("Timeout must be > 0 ms. Got: " + impact.getTimeoutMillis());
            } else {
                config.setQueryTimeout(Duration.ofMillis(impact.getTimeoutMillis()));
            }
        }
        if (impact.isFieldDetail() && impact.getKind() != EntityKind.FIELD) {
            errors.add("--field-detail requires --kind FIELD.");
        }
        if (impact.getJsonOutput() != null && Files.isDirectory(impact.getJsonOutput())) {
            errors.add("JSON output must be a file, not a directory: " + impact.getJsonOutput());
        }
        throwIfAny("impact", errors);
        Path jsonDir = impact.getJsonOutput() == null ? Path.of(".") : impact.getJsonOutput().toAbsolutePath().getParent();
        return new ValidatedOptions(normalize(source.getSourceDir()), normalize(jsonDir), config);
    }

    private AnalyzerConfig validateSource(SourceOptions o, List<String> errors) {
        if (o.getSourceDir() == null) {
            errors.add("Source directory is required (--source-dir / -s).");
        } else if (!existsDirectory(o.getSourceDir())) {
            errors.add("Source directory does not exist or is not a directory: " + o.getSourceDir());
        }
        if (o.getConfigFile() != null && !Files.isRegularFile(o.getConfigFile())) {
            errors.add("Configuration file does not exist: " + o.getConfigFile());
        }
        if (o.getParallelism() != null && o.getParallelism() <= 0) {
            errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
        }

        AnalyzerConfig config = o.getConfigFile() != null ? configLoader.load(o.getConfigFile()) : configLoader.load();
        if (o.getSourceFormat() != null) {
            config.setSourceFormat(o.getSourceFormat());
        }
        if (o.getParallelism() != null && o.getParallelism() > 0) {
            config.setParallelism(o.getParallelism());
        }
        return config;
    }

    private static void throwIfAny(String command, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(command, errors);
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
