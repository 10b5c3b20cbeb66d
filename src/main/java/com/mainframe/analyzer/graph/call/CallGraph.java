package com.mainframe.analyzer.graph.call;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Program-to-program CALL relationships, for one program or merged over a batch.
 */
@Value
@Builder
public class CallGraph {

    @Singular
    List<CallGraphNode> nodes;

    @Singular
    List<CallGraphEdge> edges;

    /**
     * Programs not called by any other program of the batch.
     */
    @Singular
    List<String> entryPoints;

    /**
     * Sorted distinct call targets that are not programs of the batch.
     */
    @Singular
    List<String> unresolvedCalls;

    public Optional<CallGraphNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }
}
