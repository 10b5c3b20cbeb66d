package com.mainframe.analyzer.config;

import com.mainframe.analyzer.parser.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalyzerConfigLoader.
 */
class AnalyzerConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final AnalyzerConfigLoader loader = new AnalyzerConfigLoader();

    @Test
    void testMissingFileGivesDefaults() {
        AnalyzerConfig config = loader.load(tempDir.resolve("absent.yml"));

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
        assertThat(config.getSourceFormat()).isEqualTo(SourceFormat.AUTO);
        assertThat(config.getDefaultMaxDepth()).isEqualTo(3);
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getSourceExtensions()).containsExactly(".cbl", ".cob", ".cobol");
    }

    @Test
    void testFullConfiguration() throws IOException {
        Path file = write("""
                sourceFormat: free
                parallelism: 2
                defaultMaxDepth: 5
                queryTimeoutSeconds: 10
                includeCopybookPrograms: false
                sourceExtensions: [".cbl"]
                copybookExtensions: [".cpy", ".inc"]
                """);

        AnalyzerConfig config = loader.load(file);

        assertThat(config.getSourceFormat()).isEqualTo(SourceFormat.FREE);
        assertThat(config.getParallelism()).isEqualTo(2);
        assertThat(config.getDefaultMaxDepth()).isEqualTo(5);
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.isIncludeCopybookPrograms()).isFalse();
        assertThat(config.getSourceExtensions()).containsExactly(".cbl");
        assertThat(config.getCopybookExtensions()).containsExactly(".cpy", ".inc");
    }

    @Test
    void testInvalidValuesFallBackIndividually() throws IOException {
        Path file = write("""
                sourceFormat: punched-cards
                parallelism: 0
                defaultMaxDepth: -2
                queryTimeoutSeconds: 15
                owner: payroll-team
                """);

        AnalyzerConfig config = loader.load(file);
        AnalyzerConfig defaults = AnalyzerConfig.defaults();

        assertThat(config.getSourceFormat()).isEqualTo(SourceFormat.AUTO);
        assertThat(config.getParallelism()).isEqualTo(defaults.getParallelism());
        assertThat(config.getDefaultMaxDepth()).isEqualTo(3);
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void testUnreadableFileGivesDefaults() throws IOException {
        Path file = write("sourceFormat: [unterminated\n");

        assertThat(loader.load(file)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void testEmptyFileGivesDefaults() throws IOException {
        assertThat(loader.load(write(""))).isEqualTo(AnalyzerConfig.defaults());
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve(AnalyzerConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, yaml);
        return file;
    }
}
