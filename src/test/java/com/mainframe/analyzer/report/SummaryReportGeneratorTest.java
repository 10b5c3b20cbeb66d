package com.mainframe.analyzer.report;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.parser.SourceFormat;
import com.mainframe.analyzer.pipeline.AnalysisPipeline;
import com.mainframe.analyzer.pipeline.BatchAnalysis;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SummaryReportGenerator.
 */
class SummaryReportGeneratorTest {

    private static String summary;
    private static BatchAnalysis batch;

    @BeforeAll
    static void render() {
        AnalysisPipeline pipeline = new AnalysisPipeline(AnalyzerConfig.builder().sourceFormat(SourceFormat.FIXED).build());
        batch = pipeline.analyze(
                TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC, TestSources.PAYCALC));
        summary = new SummaryReportGenerator().render(batch);
    }

    @Test
    void testHeader() {
        assertThat(summary)
                .startsWith("# COBOL Analysis Summary")
                .contains("Programs analyzed: 4")
                .contains("Analysis graph version: 1");
    }

    @Test
    void testProgramTable() {
        assertThat(summary)
                .contains("| CUSTMAIN | PROGRAM | CUSTMAIN.cbl | 3 |")
                .contains("| CUSTREC | COPYBOOK | CUSTREC.cpy | 0 |");
    }

    @Test
    void testCallGraphSection() {
        assertThat(summary)
                .contains("Entry points: CUSTMAIN, PAYCALC")
                .contains("Unresolved call targets: AUDITLOG, TAXCALC")
                .contains("| CUSTMAIN | CUSTUPD | STATIC | PROCESS-CUSTOMER | 55 |")
                .contains("| PAYCALC | TAXCALC | DYNAMIC |");
    }

    @Test
    void testCopybookAndCrudTables() {
        assertThat(summary)
                .contains("| CUSTREC | CUSTMAIN, CUSTUPD | yes |")
                .contains("| CUST-FILE |  | CUSTMAIN |  |  |")
                .contains("| REPORT-FILE | CUSTMAIN |  |  |  |");
    }

    @Test
    void testBusinessRules() {
        assertThat(summary)
                .contains("### PAYCALC")
                .contains("| BR-PAYCALC-1000-CALCULATE-26 | VALIDATION |")
                .contains("| 0.9 | Calculation: WS-HOURS * WS-HOURLY-RATE |");
    }

    @Test
    void testDiagnostics() {
        assertThat(summary).contains("- UNRESOLVED_REFERENCE_WARNING CUSTMAIN.cbl:56");
    }

    @Test
    void testWrite(@TempDir Path tempDir) throws IOException {
        Path target = new SummaryReportGenerator().write(batch, tempDir.resolve("reports/summary.md"));

        assertThat(Files.readString(target)).isEqualTo(summary);
    }
}
