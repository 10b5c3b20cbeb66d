package com.mainframe.analyzer.graph.cfg;

import com.mainframe.analyzer.TestSources;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Program;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ControlFlowGraphBuilder.
 */
class ControlFlowGraphBuilderTest {

    private final ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder();

    @Test
    void testPerformEdgesOfBatchProgram() {
        ControlFlowGraph cfg = builder.build(TestSources.parse(TestSources.CUSTMAIN));

        assertThat(cfg.getNodes()).extracting(CfgNode::getId)
                .containsExactly("MAIN-PARA", "READ-CUSTOMER", "PROCESS-CUSTOMER");
        assertThat(cfg.getEdges()).extracting(CfgEdge::getFrom, CfgEdge::getTo)
                .containsExactly(
                        tuple("MAIN-PARA", "READ-CUSTOMER"),
                        tuple("MAIN-PARA", "PROCESS-CUSTOMER"),
                        tuple("PROCESS-CUSTOMER", "READ-CUSTOMER"));
        assertThat(cfg.getEntryPoints()).containsExactly("MAIN-PARA");
        assertThat(cfg.getExitPoints()).containsExactly("MAIN-PARA");
        assertThat(cfg.getCyclomaticComplexity()).isEqualTo(2);
        assertThat(cfg.getPerformedBy().get("READ-CUSTOMER")).containsExactly("MAIN-PARA", "PROCESS-CUSTOMER");
    }

    @Test
    void testPerformThruAndGoTo() {
        ControlFlowGraph cfg = builder.build(TestSources.parse(TestSources.PAYCALC));

        assertThat(cfg.getEdges()).hasSize(4);
        assertThat(cfg.getEdges())
                .filteredOn(e -> e.getType() == CfgEdgeType.GOTO)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getFrom()).isEqualTo("1000-CALCULATE");
                    assertThat(e.getTo()).isEqualTo("1000-EXIT");
                });
        assertThat(cfg.getEdges()).allMatch(CfgEdge::isResolved);
        assertThat(cfg.getCyclomaticComplexity()).isEqualTo(2);
        assertThat(cfg.getExitPoints()).containsExactly("0000-MAIN");
        assertThat(cfg.getUnresolvedTargets()).isEmpty();
    }

    @Test
    void testMutualRecursionComplexity() {
        Program program = TestSources.parseText("""
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. LOOPER.
                       PROCEDURE DIVISION.
                       PARA-A.
                           PERFORM PARA-B.
                       PARA-B.
                           GO TO PARA-A.
                """, "LOOPER.cbl");

        ControlFlowGraph cfg = builder.build(program);

        assertThat(cfg.getEdges()).hasSize(2);
        assertThat(cfg.getCyclomaticComplexity()).isEqualTo(2);
        assertThat(cfg.getExitPoints()).isEmpty();
    }

    @Test
    void testGoToDependingOnAndUnresolvedTarget() {
        Program program = TestSources.parseText("""
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. ROUTER.
                       PROCEDURE DIVISION.
                       DISPATCH.
                           GO TO OPT-1 OPT-2 DEPENDING ON WS-CHOICE
                           PERFORM NO-SUCH-PARA
                           STOP RUN.
                       OPT-1.
                           EXIT.
                       OPT-2.
                           EXIT PROGRAM.
                """, "ROUTER.cbl");

        ControlFlowGraph cfg = builder.build(program);

        assertThat(cfg.getEdges()).extracting(CfgEdge::getTo).containsExactly("OPT-1", "OPT-2", "NO-SUCH-PARA");
        assertThat(cfg.getEdges().get(2).isResolved()).isFalse();
        assertThat(cfg.getUnresolvedTargets()).containsExactly("NO-SUCH-PARA");
        assertThat(cfg.getExitPoints()).containsExactly("DISPATCH", "OPT-2");
        assertThat(program.getDiagnostics().warningsOf(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING))
                .singleElement()
                .satisfies(w -> assertThat(w.getMessage()).contains("NO-SUCH-PARA"));
    }

    @Test
    void testEmptyProcedureDivision() {
        Program program = TestSources.parseText("""
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. EMPTY.
                       PROCEDURE DIVISION.
                """, "EMPTY.cbl");

        ControlFlowGraph cfg = builder.build(program);

        assertThat(cfg.getNodes()).isEmpty();
        assertThat(cfg.getEntryPoints()).containsExactly("EMPTY");
        assertThat(cfg.getCyclomaticComplexity()).isEqualTo(1);
    }
}
