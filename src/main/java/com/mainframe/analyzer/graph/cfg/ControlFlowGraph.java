package com.mainframe.analyzer.graph.cfg;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Paragraph-level control flow of one program.
 */
@Value
@Builder
public class ControlFlowGraph {

    @NonNull
    String programId;

    @Singular
    List<CfgNode> nodes;

    @Singular
    List<CfgEdge> edges;

    @Singular
    List<String> entryPoints;

    /**
     * Paragraphs that end the run unit or return: GOBACK, STOP RUN, EXIT PROGRAM.
     */
    @Singular
    List<String> exitPoints;

    /**
     * Sorted distinct PERFORM / GO TO targets that name no paragraph or section.
     */
    @Singular
    List<String> unresolvedTargets;

    /**
     * McCabe M = E - N + 2 with one connected component, never below 1.
     */
    int cyclomaticComplexity;

    /**
     * Target paragraph to the paragraphs that PERFORM it, in statement order.
     */
    @Singular("performedByEntry")
    Map<String, List<String>> performedBy;
}
