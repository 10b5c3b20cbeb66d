package com.mainframe.analyzer.integration;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.cli.AnalyzerCommand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests running the command line against a directory of sample sources.
 */
class AnalyzerCommandIntegrationTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path outputDir;

    @BeforeEach
    void copySources() throws IOException {
        Files.createDirectories(tempDir.resolve("src/copy"));
        sourceDir = tempDir.resolve("src");
        outputDir = tempDir.resolve("out");
        for (String name : new String[] {TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.PAYCALC}) {
            Files.writeString(sourceDir.resolve(name), TestSources.read(name));
        }
        Files.writeString(sourceDir.resolve("copy").resolve(TestSources.CUSTREC), TestSources.read(TestSources.CUSTREC));
    }

    @Test
    void testAnalyzeWritesJsonAndSummary() throws IOException {
        int exitCode = run("analyze", "-s", sourceDir.toString(), "-o", outputDir.toString(), "--format", "FIXED");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(outputDir.resolve("analysis.json").toFile());
        assertThat(json.get("results")).hasSize(4);
        assertThat(json.get("callGraph").get("entryPoints").toString()).isEqualTo("[\"CUSTMAIN\",\"PAYCALC\"]");

        String summary = Files.readString(outputDir.resolve("analysis-summary.md"));
        assertThat(summary).contains("Programs analyzed: 4").contains("| CUSTREC | CUSTMAIN, CUSTUPD | yes |");
    }

    @Test
    void testAnalyzeWithoutSummary() {
        int exitCode = run("analyze", "-s", sourceDir.toString(), "-o", outputDir.toString(), "--no-summary");

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("analysis.json")).exists();
        assertThat(outputDir.resolve("analysis-summary.md")).doesNotExist();
    }

    @Test
    void testImpactOfCopybookChange() throws IOException {
        Path report = outputDir.resolve("impact.json");

        int exitCode = run("impact", "-s", sourceDir.toString(), "--format", "FIXED",
                "-k", "COPYBOOK", "-i", "CUSTREC", "-d", "1", "--json", report.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertThat(json.get("status").asText()).isEqualTo("OK");
        assertThat(json.get("direct").get(0).get("entity").get("id").asText()).isEqualTo("CUSTMAIN");
    }

    @Test
    void testImpactOfUnknownEntity() {
        assertThat(run("impact", "-s", sourceDir.toString(), "-i", "NOSUCHPGM")).isEqualTo(3);
    }

    @Test
    void testInstantImpact() {
        assertThat(run("impact", "-s", sourceDir.toString(), "-i", "CUSTUPD", "--instant")).isZero();
    }

    @Test
    void testInvalidOptions() {
        assertThat(run("analyze", "-s", tempDir.resolve("nowhere").toString())).isEqualTo(2);
        assertThat(run("impact", "-s", sourceDir.toString(), "-i", "CUSTUPD", "-d", "-2")).isEqualTo(2);
    }

    @Test
    void testEmptySourceDirectory() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        assertThat(run("analyze", "-s", empty.toString(), "-o", outputDir.toString())).isEqualTo(1);
    }

    private static int run(String... args) {
        return new CommandLine(new AnalyzerCommand()).execute(args);
    }
}
