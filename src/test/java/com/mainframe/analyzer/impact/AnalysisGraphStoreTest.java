package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.graph.call.CallGraph;
import com.mainframe.analyzer.impact.exception.GraphNotFoundException;
import com.mainframe.analyzer.lineage.FileIoMap;
import com.mainframe.analyzer.lineage.WhereUsedIndex;
import com.mainframe.analyzer.parser.SourceFormat;
import com.mainframe.analyzer.pipeline.AnalysisPipeline;
import com.mainframe.analyzer.pipeline.BatchAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalysisGraphStore and the graph it publishes.
 */
class AnalysisGraphStoreTest {

    @Test
    void testNothingPublishedYet() {
        AnalysisGraphStore store = new AnalysisGraphStore();

        assertThat(store.find()).isEmpty();
        assertThat(store.currentBatch()).isEmpty();
        assertThatThrownBy(store::current)
                .isInstanceOf(GraphNotFoundException.class)
                .hasMessageContaining("No analysis graph");
    }

    @Test
    void testEachPublicationBumpsTheVersion() {
        AnalysisGraphStore store = new AnalysisGraphStore();

        BatchAnalysis first = store.publish(emptyBatch());
        AnalysisGraph firstGraph = store.current();
        BatchAnalysis second = store.publish(emptyBatch());

        assertThat(first.getGraphVersion()).isEqualTo(1);
        assertThat(second.getGraphVersion()).isEqualTo(2);
        assertThat(store.current().getVersion()).isEqualTo(2);
        assertThat(store.currentBatch()).contains(second);
        // a reader holding the old snapshot keeps it
        assertThat(firstGraph.getVersion()).isEqualTo(1);
        assertThat(firstGraph.getNodes()).isEmpty();
    }

    @Test
    void testGraphOfCustomerBatch() {
        AnalysisPipeline pipeline = new AnalysisPipeline(AnalyzerConfig.builder()
                .sourceFormat(SourceFormat.FIXED)
                .parallelism(1)
                .build());
        pipeline.analyze(TestSources.units(TestSources.CUSTMAIN, TestSources.CUSTUPD, TestSources.CUSTREC));

        AnalysisGraph graph = pipeline.getStore().current();

        assertThat(graph.nodesOf(EntityKind.PROGRAM)).extracting(EntityRef::getId)
                .containsExactly("CUSTMAIN", "CUSTUPD");
        assertThat(graph.nodesOf(EntityKind.COPYBOOK)).extracting(EntityRef::getId).containsExactly("CUSTREC");
        assertThat(graph.nodesOf(EntityKind.EXTERNAL)).extracting(EntityRef::getId).containsExactly("AUDITLOG");
        assertThat(graph.nodesOf(EntityKind.FILE)).extracting(EntityRef::getId)
                .containsExactly("CUST-FILE", "REPORT-FILE");
        assertThat(graph.contains(EntityRef.paragraph("CUSTMAIN", "READ-CUSTOMER"))).isTrue();

        assertThat(graph.incoming(EntityRef.of(EntityKind.PROGRAM, "CUSTUPD")))
                .singleElement()
                .satisfies(edge -> {
                    assertThat(edge.getType()).isEqualTo(EdgeType.CALLS);
                    assertThat(edge.getStrength()).isEqualTo(DependencyStrength.STRONG);
                    assertThat(edge.getParagraph()).isEqualTo("PROCESS-CUSTOMER");
                });
        assertThat(graph.outgoing(EntityRef.of(EntityKind.FIELD, "CUST-ID")))
                .extracting(edge -> edge.getTo().getId(), DependencyEdge::getType)
                .containsExactly(tuple("WS-REPORT-KEY", EdgeType.DATA_FLOW));
        assertThat(graph.outgoing(EntityRef.of(EntityKind.COPYBOOK, "CUSTREC")))
                .hasSize(7)
                .allMatch(edge -> edge.getType() == EdgeType.DEFINES);
    }

    private static BatchAnalysis emptyBatch() {
        return BatchAnalysis.builder()
                .callGraph(CallGraph.builder().build())
                .whereUsed(WhereUsedIndex.EMPTY)
                .fileIo(FileIoMap.of(List.of()))
                .build();
    }
}
