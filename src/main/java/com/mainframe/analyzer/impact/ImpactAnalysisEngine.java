package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.impact.exception.AnalysisTimeoutException;
import com.mainframe.analyzer.lineage.DataFlowEdge;
import com.mainframe.analyzer.lineage.Reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Answers "what is affected if this entity changes" against the current graph snapshot.
 *
 * Change flows from an entity to whatever depends on it: callers of a program, programs that
 * include a copybook or use a field, programs that access a file. A program's own callees,
 * files and tables are affected too. Field values propagate along data flow edges. Each query
 * reads one snapshot from start to end, so results are stable while a refresh is published.
 */
public class ImpactAnalysisEngine {
    private static final Logger log = LoggerFactory.getLogger(ImpactAnalysisEngine.class);

    static final Comparator<ImpactedItem> ITEM_ORDER =
            Comparator.comparingInt(ImpactedItem::getDepth).thenComparing(ImpactedItem::getEntity);

    private static final int HUB_PARENTS = 3;
    private static final int MAX_CHAIN_LENGTH = 10;
    private static final int MAX_CHAINS = 100;

    private final AnalysisGraphStore store;

    public ImpactAnalysisEngine(AnalysisGraphStore store) {
        this.store = store;
    }

    public ImpactReport analyzeImpact(EntityKind kind, String id, int maxDepth) {
        return analyzeImpact(kind, id, maxDepth, QueryOptions.DEFAULTS);
    }

    public ImpactReport analyzeImpact(EntityKind kind, String id, int maxDepth, QueryOptions options) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        AnalysisGraph graph = store.current();
        EntityRef root = EntityRef.of(kind, id);
        if (!graph.contains(root)) {
            log.debug("Impact root {} not in graph v{}", root, graph.getVersion());
            return ImpactReport.notFound(root, graph.getVersion());
        }

        Traversal traversal = new Traversal(graph, root, options);
        traversal.run(maxDepth);

        List<ImpactedItem> items = traversal.items();
        ImpactReport.ImpactReportBuilder report = ImpactReport.builder()
                .status(ImpactStatus.OK)
                .source(root)
                .rippleEffect(RippleEffect.of(items))
                .metrics(ImpactMetrics.of(items))
                .truncated(traversal.truncated)
                .graphVersion(graph.getVersion());
        for (ImpactedItem item : items) {
            switch (item.getChangeType()) {
                case DIRECT -> report.directItem(item);
                case INDIRECT -> report.indirectItem(item);
                case CASCADING -> report.cascadingItem(item);
            }
        }
        log.info("Impact of {} (depth {}): {} items{}", root, maxDepth, items.size(),
                traversal.truncated ? ", truncated" : "");
        return report.build();
    }

    /**
     * Counts depth-1 and depth-2 dependents without building a report.
     */
    public InstantImpact getInstantImpact(EntityKind kind, String id) {
        AnalysisGraph graph = store.current();
        EntityRef root = EntityRef.of(kind, id);
        if (!graph.contains(root)) {
            return new InstantImpact(root, false, 0, 0, Severity.LOW, root + " not found");
        }
        Set<EntityRef> direct = new TreeSet<>();
        for (Step step : dependents(graph, root)) {
            direct.add(step.target);
        }
        direct.remove(root);
        Set<EntityRef> indirect = new TreeSet<>();
        for (EntityRef ref : direct) {
            if (ref.getKind() == EntityKind.EXTERNAL) {
                continue;
            }
            for (Step step : dependents(graph, ref)) {
                if (!step.target.equals(root) && !direct.contains(step.target)) {
                    indirect.add(step.target);
                }
            }
        }
        Severity risk = InstantImpact.riskOf(direct.size(), indirect.size());
        String summary = String.format(Locale.ROOT, "%d direct and %d indirect dependents, %s risk",
                direct.size(), indirect.size(), risk.name().toLowerCase(Locale.ROOT));
        return new InstantImpact(root, true, direct.size(), indirect.size(), risk, summary);
    }

    public FieldImpactAnalysis analyzeFieldImpact(String fieldName) {
        AnalysisGraph graph = store.current();
        String field = fieldName.trim().toUpperCase(Locale.ROOT);
        List<Reference> usages = graph.getWhereUsed().dataItemReferences(field);

        FieldImpactAnalysis.FieldImpactAnalysisBuilder analysis = FieldImpactAnalysis.builder()
                .fieldName(field)
                .usages(usages)
                .propagationChains(propagationChains(graph.getDataFlows(), field));

        Set<String> programs = new TreeSet<>();
        for (DependencyEdge edge : graph.incoming(EntityRef.of(EntityKind.FIELD, field))) {
            if (edge.getType() == EdgeType.DEFINES) {
                analysis.definer(edge.getFrom().getId());
                if (edge.getFrom().getKind() == EntityKind.PROGRAM) {
                    programs.add(edge.getFrom().getId());
                }
            }
        }
        for (Reference usage : usages) {
            programs.add(usage.getProgram());
        }
        return analysis.affectedPrograms(programs).build();
    }

    /**
     * Maximal acyclic paths along data flow edges starting at the field.
     */
    static List<List<String>> propagationChains(List<DataFlowEdge> flows, String field) {
        Map<String, Set<String>> next = new LinkedHashMap<>();
        for (DataFlowEdge flow : flows) {
            if (!flow.getSourceField().equals(flow.getTargetField())) {
                next.computeIfAbsent(flow.getSourceField(), k -> new LinkedHashSet<>()).add(flow.getTargetField());
            }
        }
        List<List<String>> chains = new ArrayList<>();
        List<String> path = new ArrayList<>();
        path.add(field);
        extend(next, path, chains);
        return chains;
    }

    private static void extend(Map<String, Set<String>> next, List<String> path, List<List<String>> chains) {
        if (chains.size() >= MAX_CHAINS) {
            return;
        }
        String last = path.get(path.size() - 1);
        boolean extended = false;
        if (path.size() < MAX_CHAIN_LENGTH) {
            for (String target : next.getOrDefault(last, Set.of())) {
                if (!path.contains(target)) {
                    extended = true;
                    path.add(target);
                    extend(next, path, chains);
                    path.remove(path.size() - 1);
                }
            }
        }
        if (!extended && path.size() > 1) {
            chains.add(List.copyOf(path));
        }
    }

    /**
     * Entities affected by a change to {@code node}, in edge order.
     */
    static List<Step> dependents(AnalysisGraph graph, EntityRef node) {
        List<Step> steps = new ArrayList<>();
        for (DependencyEdge edge : graph.incoming(node)) {
            if (edge.getType() != EdgeType.DATA_FLOW) {
                steps.add(new Step(edge.getFrom(), edge, true));
            }
        }
        for (DependencyEdge edge : graph.outgoing(node)) {
            if (followsForward(node.getKind(), edge.getType())) {
                steps.add(new Step(edge.getTo(), edge, false));
            }
        }
        return steps;
    }

    private static boolean followsForward(EntityKind kind, EdgeType type) {
        return switch (kind) {
            case PROGRAM -> type == EdgeType.CALLS || type == EdgeType.FILE_IO || type == EdgeType.DATABASE;
            case COPYBOOK -> type == EdgeType.DEFINES;
            case FIELD -> type == EdgeType.DATA_FLOW;
            default -> false;
        };
    }

    static Severity severityOf(int depth, DependencyEdge edge) {
        if (depth >= 3) {
            return Severity.LOW;
        }
        if (depth == 2) {
            return Severity.MEDIUM;
        }
        return switch (edge.getType()) {
            case DATABASE, INCLUDES -> Severity.HIGH;
            case CALLS -> edge.getStrength() == DependencyStrength.STRONG ? Severity.HIGH : Severity.MEDIUM;
            default -> Severity.MEDIUM;
        };
    }

    static String relationship(Step step, EntityRef from) {
        if (step.target.getKind() == EntityKind.EXTERNAL) {
            return "unknown downstream effect";
        }
        String verb = switch (step.edge.getType()) {
            case CALLS -> step.reverse ? "calls" : "called by";
            case INCLUDES -> step.reverse ? "includes" : "included by";
            case DEFINES -> step.reverse ? "defines" : "defined by";
            case FILE_IO -> step.reverse ? "accesses" : "accessed by";
            case DATABASE -> step.reverse ? "queries" : "queried by";
            case DATA_FLOW -> step.reverse ? "feeds" : "fed by";
            case USES_FIELD -> step.reverse ? "uses" : "used by";
        };
        return verb + " " + from.getId();
    }

    static final class Step {
        final EntityRef target;
        final DependencyEdge edge;
        /** reached against the edge direction */
        final boolean reverse;

        Step(EntityRef target, DependencyEdge edge, boolean reverse) {
            this.target = target;
            this.edge = edge;
            this.reverse = reverse;
        }
    }

    /**
     * Breadth-first walk from the root. State is local to one query.
     */
    private static final class Traversal {
        private final AnalysisGraph graph;
        private final EntityRef root;
        private final QueryOptions options;
        private final Set<EntityRef> visited = new HashSet<>();
        private final Map<EntityRef, ImpactedItem> found = new LinkedHashMap<>();
        private final Map<EntityRef, Set<EntityRef>> depthOneParents = new HashMap<>();
        boolean truncated;

        Traversal(AnalysisGraph graph, EntityRef root, QueryOptions options) {
            this.graph = graph;
            this.root = root;
            this.options = options;
        }

        void run(int maxDepth) {
            visited.add(root);
            Set<EntityRef> frontier = new TreeSet<>();
            frontier.add(root);
            for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
                Set<EntityRef> next = new TreeSet<>();
                for (EntityRef node : frontier) {
                    if (deadlinePassed()) {
                        return;
                    }
                    if (node.getKind() == EntityKind.EXTERNAL && !node.equals(root)) {
                        truncated = true;
                        continue;
                    }
                    expand(node, depth, next);
                }
                frontier = next;
            }
            for (EntityRef node : frontier) {
                if (node.getKind() == EntityKind.EXTERNAL) {
                    truncated = true;
                } else if (dependents(graph, node).stream().anyMatch(s -> !visited.contains(s.target))) {
                    truncated = true;
                    return;
                }
            }
        }

        private void expand(EntityRef node, int depth, Set<EntityRef> next) {
            for (Step step : dependents(graph, node)) {
                EntityRef target = step.target;
                if (depth >= 2 && target.getKind() == EntityKind.FIELD && !options.isIncludeCascading()) {
                    continue;
                }
                if (depth == 2) {
                    depthOneParents.computeIfAbsent(target, k -> new HashSet<>()).add(node);
                }
                if (!visited.add(target)) {
                    continue;
                }
                found.put(target, ImpactedItem.builder()
                        .entity(target)
                        .depth(depth)
                        .severity(severityOf(depth, step.edge))
                        .relationship(relationship(step, node))
                        .changeType(ChangeType.of(depth, target))
                        .via(node)
                        .edgeType(step.edge.getType())
                        .lineNumber(step.edge.getLineNumber())
                        .build());
                next.add(target);
            }
        }

        private boolean deadlinePassed() {
            Instant deadline = options.getDeadline();
            if (deadline == null || Instant.now().isBefore(deadline)) {
                return false;
            }
            if (!options.isBestEffort()) {
                throw new AnalysisTimeoutException("Impact query for " + root + " passed its deadline", found.size());
            }
            truncated = true;
            return true;
        }

        List<ImpactedItem> items() {
            List<ImpactedItem> items = new ArrayList<>();
            for (ImpactedItem item : found.values()) {
                Set<EntityRef> parents = depthOneParents.getOrDefault(item.getEntity(), Set.of());
                if (item.getDepth() == 2 && parents.size() >= HUB_PARENTS) {
                    item = item.toBuilder().severity(Severity.CRITICAL).build();
                }
                items.add(item);
            }
            items.sort(ITEM_ORDER);
            return items;
        }
    }
}
