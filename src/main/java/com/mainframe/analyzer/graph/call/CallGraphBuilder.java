package com.mainframe.analyzer.graph.call;

import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.payload.CallPayload;
import com.mainframe.analyzer.parser.CobolText;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts CALL relationships and merges them across a batch.
 *
 * A literal target is a STATIC call. An identifier target is DYNAMIC; when the identifier is a
 * WORKING-STORAGE item with a literal VALUE, that value is taken as the called program.
 */
public class CallGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    /**
     * Call edges of one program, in statement order.
     */
    public List<CallGraphEdge> extractCalls(Program program) {
        List<CallGraphEdge> edges = new ArrayList<>();
        for (Paragraph paragraph : program.getParagraphs()) {
            for (Statement statement : paragraph.getStatements()) {
                CallPayload call = statement.payloadAs(CallPayload.class);
                if (call == null || call.getTarget().isEmpty()) {
                    continue;
                }
                String target = call.getTarget();
                String variable = null;
                if (call.isDynamic()) {
                    variable = target;
                    target = resolveDynamicTarget(program, target).orElse(target);
                }
                edges.add(CallGraphEdge.builder()
                        .from(program.getProgramId())
                        .to(target)
                        .callType(call.isDynamic() ? CallType.DYNAMIC : CallType.STATIC)
                        .parameters(call.getUsing())
                        .paragraph(paragraph.getName())
                        .lineNumber(statement.getLineNumber())
                        .targetVariable(variable)
                        .build());
            }
        }
        return edges;
    }

    /**
     * Call graph of a single program against the ids of its batch.
     */
    public CallGraph build(Program program, Set<String> batchProgramIds) {
        List<CallGraphEdge> edges = extractCalls(program);
        CallGraph.CallGraphBuilder graph = CallGraph.builder()
                .node(new CallGraphNode(program.getProgramId(), CallNodeType.MAIN, program.getFileName()))
                .edges(edges)
                .entryPoint(program.getProgramId());

        Set<String> targets = new LinkedHashSet<>();
        Set<String> unresolved = new TreeSet<>();
        for (CallGraphEdge edge : edges) {
            if (edge.getTo().equals(program.getProgramId()) || !targets.add(edge.getTo())) {
                continue;
            }
            boolean known = batchProgramIds.contains(edge.getTo());
            graph.node(new CallGraphNode(edge.getTo(), known ? CallNodeType.SUBPROGRAM : CallNodeType.EXTERNAL, null));
            if (!known) {
                unresolved.add(edge.getTo());
            }
        }
        return graph.unresolvedCalls(unresolved).build();
    }

    /**
     * One graph over every program of the batch. Called by another batch program means
     * SUBPROGRAM, otherwise MAIN; targets outside the batch become EXTERNAL nodes.
     */
    public CallGraph merge(List<Program> programs) {
        Set<String> batchIds = new LinkedHashSet<>();
        for (Program program : programs) {
            if (!program.isCopybook()) {
                batchIds.add(program.getProgramId());
            }
        }

        List<CallGraphEdge> edges = new ArrayList<>();
        Set<String> calledByOthers = new HashSet<>();
        Set<String> unresolved = new TreeSet<>();
        for (Program program : programs) {
            if (program.isCopybook()) {
                continue;
            }
            for (CallGraphEdge edge : extractCalls(program)) {
                edges.add(edge);
                if (!edge.getTo().equals(edge.getFrom())) {
                    calledByOthers.add(edge.getTo());
                }
                if (!batchIds.contains(edge.getTo()) && unresolved.add(edge.getTo())) {
                    program.getDiagnostics().warn(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING, edge.getLineNumber(),
                            "CALL target " + edge.getTo() + " is not part of the analyzed batch");
                }
            }
        }

        CallGraph.CallGraphBuilder graph = CallGraph.builder().edges(edges);
        for (Program program : programs) {
            if (program.isCopybook()) {
                continue;
            }
            String id = program.getProgramId();
            boolean called = calledByOthers.contains(id);
            graph.node(new CallGraphNode(id, called ? CallNodeType.SUBPROGRAM : CallNodeType.MAIN, program.getFileName()));
            if (!called) {
                graph.entryPoint(id);
            }
        }
        for (String external : unresolved) {
            graph.node(new CallGraphNode(external, CallNodeType.EXTERNAL, null));
        }

        log.info("Merged call graph: {} programs, {} edges, {} unresolved targets", batchIds.size(),
                edges.size(), unresolved.size());
        return graph.unresolvedCalls(unresolved).build();
    }

    private static Optional<String> resolveDynamicTarget(Program program, String identifier) {
        return program.findDataItem(identifier)
                .filter(item -> item.getSection() == DataSection.WORKING_STORAGE)
                .map(DataItem::getValue)
                .filter(value -> !value.isBlank() && !CobolText.FIGURATIVE_CONSTANTS.contains(value))
                .map(value -> value.trim().toUpperCase(Locale.ROOT));
    }
}
