package com.mainframe.analyzer.graph.call;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.model.Diagnostic;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Program;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CallGraphBuilder.
 */
class CallGraphBuilderTest {

    private final CallGraphBuilder builder = new CallGraphBuilder();

    @Test
    void testStaticCallsInStatementOrder() {
        List<CallGraphEdge> edges = builder.extractCalls(TestSources.parse(TestSources.CUSTMAIN));

        assertThat(edges).extracting(CallGraphEdge::getTo).containsExactly("CUSTUPD", "AUDITLOG");
        CallGraphEdge first = edges.get(0);
        assertThat(first.getFrom()).isEqualTo("CUSTMAIN");
        assertThat(first.getCallType()).isEqualTo(CallType.STATIC);
        assertThat(first.getParameters()).containsExactly("CUSTOMER-RECORD");
        assertThat(first.getParagraph()).isEqualTo("PROCESS-CUSTOMER");
        assertThat(first.getLineNumber()).isEqualTo(55);
        assertThat(first.getTargetVariable()).isNull();
    }

    @Test
    void testDynamicCallResolvedThroughValueClause() {
        CallGraph graph = builder.build(TestSources.parse(TestSources.PAYCALC), Set.of("PAYCALC"));

        assertThat(graph.getEdges()).singleElement().satisfies(edge -> {
            assertThat(edge.getTo()).isEqualTo("TAXCALC");
            assertThat(edge.getCallType()).isEqualTo(CallType.DYNAMIC);
            assertThat(edge.getTargetVariable()).isEqualTo("WS-CALL-TARGET");
            assertThat(edge.getParameters()).containsExactly("WS-GROSS-PAY", "WS-TAX");
        });
        assertThat(graph.findNode("PAYCALC")).get().extracting(CallGraphNode::getType).isEqualTo(CallNodeType.MAIN);
        assertThat(graph.findNode("TAXCALC")).get().extracting(CallGraphNode::getType).isEqualTo(CallNodeType.EXTERNAL);
        assertThat(graph.getUnresolvedCalls()).containsExactly("TAXCALC");
    }

    @Test
    void testMergeClassifiesProgramsAcrossBatch() {
        Program main = TestSources.parse(TestSources.CUSTMAIN);
        Program sub = TestSources.parse(TestSources.CUSTUPD);
        Program copybook = TestSources.parse(TestSources.CUSTREC);

        CallGraph graph = builder.merge(List.of(main, sub, copybook));

        assertThat(graph.getNodes()).extracting(CallGraphNode::getId, CallGraphNode::getType)
                .containsExactly(
                        tuple("CUSTMAIN", CallNodeType.MAIN),
                        tuple("CUSTUPD", CallNodeType.SUBPROGRAM),
                        tuple("AUDITLOG", CallNodeType.EXTERNAL));
        assertThat(graph.getEntryPoints()).containsExactly("CUSTMAIN");
        assertThat(graph.getUnresolvedCalls()).containsExactly("AUDITLOG");
        assertThat(graph.findNode("CUSTUPD")).get().extracting(CallGraphNode::getFileName).isEqualTo("CUSTUPD.cbl");
    }

    @Test
    void testMergeWarnsOnceForCallOutsideBatch() {
        Program main = TestSources.parse(TestSources.CUSTMAIN);

        builder.merge(List.of(main, TestSources.parse(TestSources.CUSTUPD)));

        assertThat(main.getDiagnostics().warningsOf(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING))
                .extracting(Diagnostic::getLineNumber)
                .containsExactly(56);
    }
}
