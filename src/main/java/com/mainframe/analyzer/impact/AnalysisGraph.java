package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.lineage.DataFlowEdge;
import com.mainframe.analyzer.lineage.WhereUsedIndex;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of every entity and dependency in an analyzed batch.
 *
 * Instances are created by {@link AnalysisGraphBuilder} and published through
 * {@link AnalysisGraphStore}; queries never mutate them, so readers need no locking.
 */
public final class AnalysisGraph {

    @Getter
    private final long version;
    private final Set<EntityRef> nodes;
    private final Map<EntityRef, List<DependencyEdge>> outgoing;
    private final Map<EntityRef, List<DependencyEdge>> incoming;
    @Getter
    private final WhereUsedIndex whereUsed;
    @Getter
    private final List<DataFlowEdge> dataFlows;
    @Getter
    private final List<DependencyEdge> edges;

    AnalysisGraph(long version, Set<EntityRef> nodes, List<DependencyEdge> edges, WhereUsedIndex whereUsed,
                  List<DataFlowEdge> dataFlows) {
        this.version = version;
        this.nodes = Collections.unmodifiableSet(new TreeSet<>(nodes));
        Map<EntityRef, List<DependencyEdge>> out = new TreeMap<>();
        Map<EntityRef, List<DependencyEdge>> in = new TreeMap<>();
        for (DependencyEdge edge : edges) {
            out.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
        this.whereUsed = whereUsed;
        this.dataFlows = List.copyOf(dataFlows);
        this.edges = List.copyOf(edges);
    }

    public static AnalysisGraph empty() {
        return new AnalysisGraph(0, Set.of(), List.of(), WhereUsedIndex.EMPTY, List.of());
    }

    public boolean contains(EntityRef ref) {
        return nodes.contains(ref);
    }

    public Set<EntityRef> getNodes() {
        return nodes;
    }

    public List<DependencyEdge> outgoing(EntityRef ref) {
        return outgoing.getOrDefault(ref, List.of());
    }

    public List<DependencyEdge> incoming(EntityRef ref) {
        return incoming.getOrDefault(ref, List.of());
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public List<EntityRef> nodesOf(EntityKind kind) {
        List<EntityRef> result = new ArrayList<>();
        for (EntityRef node : nodes) {
            if (node.getKind() == kind) {
                result.add(node);
            }
        }
        return result;
    }

    private static Map<EntityRef, List<DependencyEdge>> freeze(Map<EntityRef, List<DependencyEdge>> source) {
        Map<EntityRef, List<DependencyEdge>> copy = new TreeMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
