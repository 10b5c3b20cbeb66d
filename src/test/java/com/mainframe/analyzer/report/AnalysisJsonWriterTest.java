package com.mainframe.analyzer.report;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.impact.EntityKind;
import com.mainframe.analyzer.impact.ImpactAnalysisEngine;
import com.mainframe.analyzer.impact.ImpactReport;
import com.mainframe.analyzer.parser.SourceFormat;
import com.mainframe.analyzer.pipeline.AnalysisPipeline;
import com.mainframe.analyzer.pipeline.BatchAnalysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalysisJsonWriter.
 */
class AnalysisJsonWriterTest {

    @TempDir
    Path tempDir;

    private final AnalysisJsonWriter writer = new AnalysisJsonWriter();
    private final ObjectMapper reader = new ObjectMapper();

    private AnalysisPipeline pipeline;
    private BatchAnalysis batch;

    @BeforeEach
    void setUp() {
        pipeline = new AnalysisPipeline(AnalyzerConfig.builder().sourceFormat(SourceFormat.FIXED).build());
        batch = pipeline.analyze(TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));
    }

    @Test
    void testBatchJson() throws IOException {
        JsonNode json = reader.readTree(writer.toJson(batch));

        assertThat(json.get("graphVersion").asInt()).isEqualTo(1);
        assertThat(json.get("results")).hasSize(3);
        assertThat(json.get("results").get(0).get("programModel").get("programId").asText()).isEqualTo("CUSTMAIN");
        assertThat(json.get("callGraph").get("unresolvedCalls").get(0).asText()).isEqualTo("AUDITLOG");
        assertThat(json.has("programs")).isFalse();
        assertThat(json.has("diagnosticCount")).isFalse();
    }

    @Test
    void testImpactReportJson() throws IOException {
        ImpactReport report = new ImpactAnalysisEngine(pipeline.getStore())
                .analyzeImpact(EntityKind.PROGRAM, "CUSTUPD", 2);

        JsonNode json = reader.readTree(writer.toJson(report));

        assertThat(json.get("status").asText()).isEqualTo("OK");
        assertThat(json.get("source").get("id").asText()).isEqualTo("CUSTUPD");
        assertThat(json.get("direct").get(0).get("relationship").asText()).isEqualTo("calls CUSTUPD");
        assertThat(json.get("truncated").asBoolean()).isTrue();
        assertThat(json.has("found")).isFalse();
        assertThat(json.has("impactedItems")).isFalse();
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("out/nested/batch.json");

        Path written = writer.write(batch, target);

        assertThat(written).exists();
        assertThat(Files.readString(written)).startsWith("{").contains("\"graphVersion\" : 1");
    }

    @Test
    void testWriteFailureIsWrapped() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("plain-file"), "x");

        assertThatThrownBy(() -> writer.write(batch, blocker.resolve("batch.json")))
                .isInstanceOf(ReportGenerationException.class)
                .hasMessageContaining("batch.json");
    }
}
