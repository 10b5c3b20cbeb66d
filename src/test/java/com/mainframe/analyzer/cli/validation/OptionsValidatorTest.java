package com.mainframe.analyzer.cli.validation;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.model.AnalyzeOptions;
import com.mainframe.analyzer.cli.model.ImpactOptions;
import com.mainframe.analyzer.cli.model.SourceOptions;
import com.mainframe.analyzer.cli.model.ValidatedOptions;
import com.mainframe.analyzer.parser.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OptionsValidator.
 */
class OptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final OptionsValidator validator = new OptionsValidator();

    @Command(name = "analyze")
    static class AnalyzeArgs {
        @Mixin
        SourceOptions source = new SourceOptions();
        @Mixin
        AnalyzeOptions analyze = new AnalyzeOptions();
    }

    @Command(name = "impact")
    static class ImpactArgs {
        @Mixin
        SourceOptions source = new SourceOptions();
        @Mixin
        ImpactOptions impact = new ImpactOptions();
    }

    @Test
    void testValidAnalyzeOptions() throws IOException {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        AnalyzeArgs args = analyzeArgs("-s", tempDir.toString(), "-o", out.toString(), "--format", "FREE", "-j", "2");

        ValidatedOptions v = validator.validate(args.source, args.analyze);

        assertThat(v.getNormalizedSourceDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(v.getNormalizedOutputDir()).isEqualTo(out.toAbsolutePath().normalize());
        assertThat(v.getConfig().getSourceFormat()).isEqualTo(SourceFormat.FREE);
        assertThat(v.getConfig().getParallelism()).isEqualTo(2);
    }

    @Test
    void testAllProblemsReportedTogether() throws IOException {
        Path notADir = Files.writeString(tempDir.resolve("report.txt"), "x");
        AnalyzeArgs args = analyzeArgs("-s", tempDir.resolve("missing").toString(), "-o", notADir.toString(),
                "-c", tempDir.resolve("absent.yml").toString(), "-j", "0");

        assertThatThrownBy(() -> validator.validate(args.source, args.analyze))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anyMatch(m -> m.startsWith("Source directory does not exist"))
                        .anyMatch(m -> m.startsWith("Configuration file does not exist"))
                        .contains("Parallelism must be >= 1. Got: 0")
                        .anyMatch(m -> m.startsWith("Output path exists and is not a directory")))
                .hasMessageStartingWith("analyze: 4 invalid option(s)");
    }

    @Test
    void testConfigFileIsMergedUnderCommandLine() throws IOException {
        Path config = Files.writeString(tempDir.resolve("analyzer.yml"), "sourceFormat: FIXED\nparallelism: 6\ndefaultMaxDepth: 4\n");
        ImpactArgs args = impactArgs("-s", tempDir.toString(), "-c", config.toString(), "-j", "1",
                "-i", "CUSTUPD", "--timeout-ms", "250");

        ValidatedOptions v = validator.validate(args.source, args.impact);

        assertThat(v.getConfig().getSourceFormat()).isEqualTo(SourceFormat.FIXED);
        assertThat(v.getConfig().getParallelism()).isEqualTo(1);
        assertThat(v.getConfig().getDefaultMaxDepth()).isEqualTo(4);
        assertThat(v.getConfig().getQueryTimeout()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void testInvalidImpactOptions() {
        ImpactArgs args = impactArgs("-s", tempDir.toString(), "-i", " ", "-d", "-1", "--timeout-ms", "0",
                "--field-detail", "--json", tempDir.toString());

        assertThatThrownBy(() -> validator.validate(args.source, args.impact))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .containsExactly(
                                "Entity id is required (--id / -i).",
                                "Max depth must be >= 0. Got: -1",
                                "Timeout must be > 0 ms. Got: 0",
                                "--field-detail requires --kind FIELD.",
                                "JSON output must be a file, not a directory: " + tempDir))
                .extracting(e -> ((OptionsValidationException) e).getCommand())
                .isEqualTo("impact");
    }

    @Test
    void testFieldDetailWithFieldKind() {
        ImpactArgs args = impactArgs("-s", tempDir.toString(), "-k", "FIELD", "-i", "CUST-ID", "--field-detail",
                "--json", tempDir.resolve("impact.json").toString());

        ValidatedOptions v = validator.validate(args.source, args.impact);

        assertThat(v.getNormalizedOutputDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
    }

    private static AnalyzeArgs analyzeArgs(String... argv) {
        AnalyzeArgs args = new AnalyzeArgs();
        new CommandLine(args).parseArgs(argv);
        return args;
    }

    private static ImpactArgs impactArgs(String... argv) {
        ImpactArgs args = new ImpactArgs();
        new CommandLine(args).parseArgs(argv);
        return args;
    }
}
