package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.graph.call.CallGraphEdge;
import com.mainframe.analyzer.graph.call.CallGraphNode;
import com.mainframe.analyzer.graph.call.CallNodeType;
import com.mainframe.analyzer.graph.call.CallType;
import com.mainframe.analyzer.lineage.DataFlowEdge;
import com.mainframe.analyzer.lineage.FileOperation;
import com.mainframe.analyzer.lineage.Reference;
import com.mainframe.analyzer.model.CopyDirective;
import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.payload.ExecPayload;
import com.mainframe.analyzer.pipeline.BatchAnalysis;
import com.mainframe.analyzer.pipeline.SemanticAnalysisResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a merged {@link BatchAnalysis} into an {@link AnalysisGraph}.
 *
 * Edges between the same two entities with the same type are kept once, at their first
 * occurrence.
 */
public class AnalysisGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(AnalysisGraphBuilder.class);

    public AnalysisGraph build(BatchAnalysis batch, long version) {
        Assembly assembly = new Assembly();

        for (CallGraphNode node : batch.getCallGraph().getNodes()) {
            assembly.node(EntityRef.of(node.getType() == CallNodeType.EXTERNAL ? EntityKind.EXTERNAL : EntityKind.PROGRAM,
                    node.getId()));
        }
        for (CallGraphEdge call : batch.getCallGraph().getEdges()) {
            EntityRef to = batch.getCallGraph().findNode(call.getTo())
                    .filter(n -> n.getType() == CallNodeType.EXTERNAL)
                    .map(n -> EntityRef.of(EntityKind.EXTERNAL, n.getId()))
                    .orElse(EntityRef.of(EntityKind.PROGRAM, call.getTo()));
            assembly.edge(DependencyEdge.builder()
                    .from(EntityRef.of(EntityKind.PROGRAM, call.getFrom()))
                    .to(to)
                    .type(EdgeType.CALLS)
                    .strength(call.getCallType() == CallType.STATIC ? DependencyStrength.STRONG : DependencyStrength.WEAK)
                    .lineNumber(call.getLineNumber())
                    .paragraph(call.getParagraph())
                    .build());
        }

        List<DataFlowEdge> flows = new ArrayList<>();
        for (SemanticAnalysisResult result : batch.getResults()) {
            Program program = result.getProgramModel();
            if (program.isCopybook()) {
                addCopybook(assembly, program);
                continue;
            }
            EntityRef programRef = EntityRef.of(EntityKind.PROGRAM, program.getProgramId());
            assembly.node(programRef);
            addStructure(assembly, programRef, program);
            addUsages(assembly, programRef, result);
            addFileIo(assembly, programRef, result.getFileIoMap().getOperations());
            for (DataFlowEdge flow : result.getDataLineage().getFlows()) {
                flows.add(flow);
                if (!flow.getSourceField().equals(flow.getTargetField())) {
                    assembly.edge(DependencyEdge.builder()
                            .from(EntityRef.of(EntityKind.FIELD, flow.getSourceField()))
                            .to(EntityRef.of(EntityKind.FIELD, flow.getTargetField()))
                            .type(EdgeType.DATA_FLOW)
                            .lineNumber(flow.getLocation().getLineNumber())
                            .paragraph(flow.getLocation().getParagraph())
                            .build());
                }
            }
        }

        AnalysisGraph graph = new AnalysisGraph(version, assembly.nodes, assembly.edges, batch.getWhereUsed(), flows);
        log.info("Built analysis graph v{}: {} nodes, {} edges", version, graph.getNodes().size(), graph.getEdgeCount());
        return graph;
    }

    private void addCopybook(Assembly assembly, Program copybook) {
        EntityRef copybookRef = EntityRef.of(EntityKind.COPYBOOK, copybook.getProgramId());
        assembly.node(copybookRef);
        for (DataItem item : copybook.getDataItems()) {
            if (!item.isFiller()) {
                assembly.edge(DependencyEdge.builder()
                        .from(copybookRef)
                        .to(EntityRef.of(EntityKind.FIELD, item.getName()))
                        .type(EdgeType.DEFINES)
                        .lineNumber(item.getLineNumber())
                        .build());
            }
        }
        for (CopyDirective nested : copybook.getCopyDirectives()) {
            assembly.edge(DependencyEdge.builder()
                    .from(copybookRef)
                    .to(EntityRef.of(EntityKind.COPYBOOK, nested.getCopybookName()))
                    .type(EdgeType.INCLUDES)
                    .lineNumber(nested.getLineNumber())
                    .build());
        }
    }

    private void addStructure(Assembly assembly, EntityRef programRef, Program program) {
        for (CopyDirective copy : program.getCopyDirectives()) {
            assembly.edge(DependencyEdge.builder()
                    .from(programRef)
                    .to(EntityRef.of(EntityKind.COPYBOOK, copy.getCopybookName()))
                    .type(EdgeType.INCLUDES)
                    .lineNumber(copy.getLineNumber())
                    .build());
        }
        for (DataItem item : program.getDataItems()) {
            if (!item.isFiller()) {
                assembly.edge(DependencyEdge.builder()
                        .from(programRef)
                        .to(EntityRef.of(EntityKind.FIELD, item.getName()))
                        .type(EdgeType.DEFINES)
                        .lineNumber(item.getLineNumber())
                        .build());
            }
        }
        for (Paragraph paragraph : program.getParagraphs()) {
            assembly.edge(DependencyEdge.builder()
                    .from(programRef)
                    .to(EntityRef.paragraph(program.getProgramId(), paragraph.getName()))
                    .type(EdgeType.DEFINES)
                    .lineNumber(paragraph.getLineNumber())
                    .paragraph(paragraph.getName())
                    .build());
            for (Statement statement : paragraph.getStatements()) {
                ExecPayload exec = statement.payloadAs(ExecPayload.class);
                if (exec == null) {
                    continue;
                }
                for (String table : exec.getTables()) {
                    assembly.edge(DependencyEdge.builder()
                            .from(programRef)
                            .to(EntityRef.of(EntityKind.TABLE, table))
                            .type(EdgeType.DATABASE)
                            .lineNumber(statement.getLineNumber())
                            .paragraph(paragraph.getName())
                            .build());
                }
            }
        }
    }

    private void addUsages(Assembly assembly, EntityRef programRef, SemanticAnalysisResult result) {
        for (Map.Entry<String, List<Reference>> entry : result.getWhereUsedIndex().getDataItems().entrySet()) {
            Reference first = entry.getValue().get(0);
            assembly.edge(DependencyEdge.builder()
                    .from(programRef)
                    .to(EntityRef.of(EntityKind.FIELD, entry.getKey()))
                    .type(EdgeType.USES_FIELD)
                    .strength(DependencyStrength.WEAK)
                    .lineNumber(first.getLineNumber())
                    .paragraph(first.getLocation())
                    .build());
        }
    }

    private void addFileIo(Assembly assembly, EntityRef programRef, List<FileOperation> operations) {
        for (FileOperation operation : operations) {
            assembly.edge(DependencyEdge.builder()
                    .from(programRef)
                    .to(EntityRef.of(EntityKind.FILE, operation.getFileName()))
                    .type(EdgeType.FILE_IO)
                    .lineNumber(operation.getLocation().getLineNumber())
                    .paragraph(operation.getLocation().getParagraph())
                    .build());
        }
    }

    private static final class Assembly {
        final Set<EntityRef> nodes = new LinkedHashSet<>();
        final List<DependencyEdge> edges = new ArrayList<>();
        private final Set<String> edgeKeys = new HashSet<>();

        void node(EntityRef ref) {
            nodes.add(ref);
        }

        void edge(DependencyEdge edge) {
            if (edgeKeys.add(edge.getFrom() + ">" + edge.getTo() + ">" + edge.getType())) {
                nodes.add(edge.getFrom());
                nodes.add(edge.getTo());
                edges.add(edge);
            }
        }
    }
}
