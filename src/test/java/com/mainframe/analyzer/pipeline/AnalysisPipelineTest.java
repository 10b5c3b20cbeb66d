package com.mainframe.analyzer.pipeline;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.graph.call.CallGraph;
import com.mainframe.analyzer.lineage.CopybookDependency;
import com.mainframe.analyzer.model.Diagnostic;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.parser.SourceFormat;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalysisPipeline.
 */
class AnalysisPipelineTest {

    private static final String AUDITLOG = String.join("\n",
            "       IDENTIFICATION DIVISION.",
            "       PROGRAM-ID. AUDITLOG.",
            "       DATA DIVISION.",
            "       LINKAGE SECTION.",
            "       01  LK-KEY                  PIC 9(6).",
            "       PROCEDURE DIVISION USING LK-KEY.",
            "       LOG-PARA.",
            "           DISPLAY LK-KEY",
            "           GOBACK.",
            "");

    private final AnalysisPipeline pipeline = new AnalysisPipeline(AnalyzerConfig.builder()
            .sourceFormat(SourceFormat.FIXED)
            .parallelism(3)
            .build());

    @Test
    void testBatchResults() {
        BatchAnalysis batch = pipeline.analyze(
                TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC, TestSources.PAYCALC));

        assertThat(batch.getGraphVersion()).isEqualTo(1);
        assertThat(batch.getResults()).extracting(SemanticAnalysisResult::getProgramId)
                .containsExactly("CUSTMAIN", "CUSTUPD", "CUSTREC", "PAYCALC");

        SemanticAnalysisResult main = batch.findResult("custmain").orElseThrow();
        assertThat(main.getControlFlowGraph().getNodes()).hasSize(3);
        assertThat(main.getCallGraph().getEdges()).hasSize(2);
        assertThat(main.getCopybookDependencies()).extracting(CopybookDependency::getCopybookName).containsExactly("CUSTREC");
        assertThat(main.getWorkingStorage().getItemCount()).isEqualTo(9);
        assertThat(main.getDataLineage().getFlows()).isNotEmpty();

        SemanticAnalysisResult payroll = batch.findResult("PAYCALC").orElseThrow();
        assertThat(payroll.getBusinessRules()).hasSize(7);
        assertThat(payroll.getCopybookDependencies()).isEmpty();

        CallGraph merged = batch.getCallGraph();
        assertThat(merged.getEntryPoints()).containsExactly("CUSTMAIN", "PAYCALC");
        assertThat(merged.getUnresolvedCalls()).containsExactly("AUDITLOG", "TAXCALC");
        assertThat(batch.getFileIo().getOperations()).isNotEmpty();
        assertThat(batch.getWhereUsed().dataItemReferences("CUST-ID")).isNotEmpty();
    }

    @Test
    void testCopybooksCanBeLeftOut() {
        AnalysisPipeline programsOnly = new AnalysisPipeline(AnalyzerConfig.builder()
                .sourceFormat(SourceFormat.FIXED)
                .includeCopybookPrograms(false)
                .build());

        BatchAnalysis batch = programsOnly.analyze(
                TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));

        assertThat(batch.getResults()).extracting(SemanticAnalysisResult::getProgramId)
                .containsExactly("CUSTMAIN", "CUSTUPD");
    }

    @Test
    void testReanalyzeAddsProgramAndResolvesCall() {
        pipeline.analyze(TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));

        BatchAnalysis refreshed = pipeline.reanalyze(new SourceUnit("AUDITLOG.cbl", AUDITLOG));

        assertThat(refreshed.getGraphVersion()).isEqualTo(2);
        assertThat(refreshed.getResults()).extracting(SemanticAnalysisResult::getProgramId)
                .containsExactly("CUSTMAIN", "CUSTUPD", "CUSTREC", "AUDITLOG");
        assertThat(refreshed.getCallGraph().getUnresolvedCalls()).isEmpty();
        assertThat(pipeline.getStore().current().getVersion()).isEqualTo(2);
    }

    @Test
    void testReanalyzeLeavesPublishedDiagnosticsAlone() {
        BatchAnalysis first = pipeline.analyze(
                TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));
        List<Diagnostic> before = List.copyOf(callWarnings(first, "AUDITLOG"));

        BatchAnalysis refreshed = pipeline.reanalyze(new SourceUnit("AUDITLOG.cbl", AUDITLOG));
        BatchAnalysis again = pipeline.reanalyze(new SourceUnit("AUDITLOG.cbl", AUDITLOG));

        assertThat(before).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).isEqualTo("CALL target AUDITLOG is not part of the analyzed batch"));
        assertThat(callWarnings(first, "AUDITLOG")).isEqualTo(before);
        assertThat(callWarnings(refreshed, "AUDITLOG")).isEmpty();
        assertThat(callWarnings(again, "AUDITLOG")).isEmpty();
        assertThat(refreshed.findResult("CUSTMAIN").orElseThrow().getProgramModel().getDiagnostics())
                .isNotSameAs(first.findResult("CUSTMAIN").orElseThrow().getProgramModel().getDiagnostics());
        assertThat(again.getDiagnosticCount()).isEqualTo(refreshed.getDiagnosticCount());
    }

    @Test
    void testReanalyzeReplacesProgramWithSameId() {
        pipeline.analyze(TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));
        String rewritten = String.join("\n",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. CUSTUPD.",
                "       PROCEDURE DIVISION.",
                "       MAIN-PARA.",
                "           CALL 'NEWSUB'",
                "           GOBACK.",
                "");

        BatchAnalysis refreshed = pipeline.reanalyze(new SourceUnit("CUSTUPD.cbl", rewritten));

        assertThat(refreshed.getResults()).hasSize(3);
        SemanticAnalysisResult replaced = refreshed.findResult("CUSTUPD").orElseThrow();
        assertThat(replaced.getProgramModel().getParagraphs()).extracting(p -> p.getName())
                .containsExactly("MAIN-PARA");
        assertThat(replaced.getCopybookDependencies()).isEmpty();
        assertThat(refreshed.getCallGraph().getUnresolvedCalls()).containsExactly("AUDITLOG", "NEWSUB");
    }

    @Test
    void testReanalyzeWithoutPreviousAnalysis() {
        assertThatThrownBy(() -> pipeline.reanalyze(TestSources.unit(TestSources.CUSTUPD)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("reanalyze requires a previous analysis");
    }

    @Test
    void testMissingProgramIdIsReportedNotFatal() {
        String anonymous = String.join("\n",
                "       IDENTIFICATION DIVISION.",
                "       PROCEDURE DIVISION.",
                "       ONLY-PARA.",
                "           DISPLAY 'HELLO'",
                "           STOP RUN.",
                "");

        BatchAnalysis batch = pipeline.analyze(List.of(new SourceUnit("src/anon.cbl", anonymous)));

        SemanticAnalysisResult result = batch.getResults().get(0);
        assertThat(result.getProgramId()).isEqualTo("ANON");
        assertThat(result.getProgramModel().getDiagnostics().warningsOf(DiagnosticKind.STRUCTURAL_PARSE_WARNING))
                .extracting(Diagnostic::getMessage)
                .containsExactly("PROGRAM-ID not found, using ANON");
        assertThat(batch.getDiagnosticCount()).isEqualTo(1);
    }

    @Test
    void testOversizedPictureDoesNotLoseTheProgram() {
        String source = String.join("\n",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. BIGPIC.",
                "       DATA DIVISION.",
                "       WORKING-STORAGE SECTION.",
                "       01  BAD-FIELD               PIC X(99999999999).",
                "       01  GOOD-FIELD              PIC X(10).",
                "       PROCEDURE DIVISION.",
                "       MAIN-PARA.",
                "           DISPLAY GOOD-FIELD",
                "           STOP RUN.",
                "");

        BatchAnalysis batch = pipeline.analyze(List.of(new SourceUnit("BIGPIC.cbl", source)));

        SemanticAnalysisResult result = batch.getResults().get(0);
        assertThat(result.getProgramModel().getDiagnostics().hasErrors()).isFalse();
        assertThat(result.getProgramModel().getDataItems()).extracting(item -> item.getName())
                .containsExactly("BAD-FIELD", "GOOD-FIELD");
        assertThat(result.getProgramModel().getParagraphs()).extracting(paragraph -> paragraph.getName())
                .containsExactly("MAIN-PARA");
        assertThat(result.getProgramModel().getDiagnostics().warningsOf(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING))
                .singleElement()
                .satisfies(d -> assertThat(d.getLineNumber()).isEqualTo(5));
    }

    private static List<Diagnostic> callWarnings(BatchAnalysis batch, String target) {
        return batch.findResult("CUSTMAIN").orElseThrow().getProgramModel().getDiagnostics()
                .warningsOf(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING).stream()
                .filter(d -> d.getMessage().contains("CALL target " + target))
                .collect(Collectors.toList());
    }
}
