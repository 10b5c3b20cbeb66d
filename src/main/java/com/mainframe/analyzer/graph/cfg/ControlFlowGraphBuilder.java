package com.mainframe.analyzer.graph.cfg;

import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.Section;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.GoToPayload;
import com.mainframe.analyzer.model.payload.PerformPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives PERFORM and GO TO edges between the paragraphs of a program.
 *
 * A PERFORM ... THRU contributes an edge to both ends of the range; GO TO ... DEPENDING ON one
 * edge per listed target. Targets naming a section are resolved. Edges to unknown names are kept,
 * marked unresolved, and reported as warnings on the program.
 */
public class ControlFlowGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    public ControlFlowGraph build(Program program) {
        Set<String> known = new HashSet<>();
        for (Paragraph paragraph : program.getParagraphs()) {
            known.add(paragraph.getName());
        }
        for (Section section : program.getSections()) {
            known.add(section.getName());
        }

        ControlFlowGraph.ControlFlowGraphBuilder graph = ControlFlowGraph.builder()
                .programId(program.getProgramId());
        List<CfgEdge> edges = new ArrayList<>();
        Set<String> unresolved = new TreeSet<>();
        Map<String, List<String>> performedBy = new LinkedHashMap<>();

        for (Paragraph paragraph : program.getParagraphs()) {
            graph.node(new CfgNode(paragraph.getName(), paragraph.getSection(), paragraph.getLineNumber(),
                    paragraph.getStatements().size()));

            boolean exits = false;
            for (Statement statement : paragraph.getStatements()) {
                if (statement.getKind().isTerminal() || isExitProgram(statement)) {
                    exits = true;
                }
                PerformPayload perform = statement.payloadAs(PerformPayload.class);
                if (perform != null && perform.getTarget() != null) {
                    addEdge(edges, paragraph.getName(), perform.getTarget(), CfgEdgeType.PERFORM,
                            statement.getLineNumber(), known, unresolved);
                    performedBy.computeIfAbsent(perform.getTarget(), k -> new ArrayList<>()).add(paragraph.getName());
                    if (perform.getThruTarget() != null) {
                        addEdge(edges, paragraph.getName(), perform.getThruTarget(), CfgEdgeType.PERFORM,
                                statement.getLineNumber(), known, unresolved);
                    }
                }
                GoToPayload goTo = statement.payloadAs(GoToPayload.class);
                if (goTo != null) {
                    for (String target : goTo.getTargets()) {
                        addEdge(edges, paragraph.getName(), target, CfgEdgeType.GOTO,
                                statement.getLineNumber(), known, unresolved);
                    }
                }
            }
            if (exits) {
                graph.exitPoint(paragraph.getName());
            }
        }

        for (String target : unresolved) {
            program.getDiagnostics().warn(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING, 0,
                    "PERFORM/GO TO target " + target + " is not a paragraph or section of " + program.getProgramId());
        }

        performedBy.replaceAll((target, performers) -> List.copyOf(performers));
        int nodes = program.getParagraphs().size();
        // E - N + 2 for one connected component; a procedure without paragraphs has a single path
        int complexity = nodes == 0 ? 1 : Math.max(1, edges.size() - nodes + 2);
        String entry = program.getParagraphs().isEmpty()
                ? program.getProgramId()
                : program.getParagraphs().get(0).getName();

        log.debug("CFG for {}: {} nodes, {} edges, complexity {}", program.getProgramId(), nodes,
                edges.size(), complexity);
        return graph
                .edges(edges)
                .entryPoint(entry)
                .unresolvedTargets(unresolved)
                .cyclomaticComplexity(complexity)
                .performedBy(performedBy)
                .build();
    }

    private void addEdge(List<CfgEdge> edges, String from, String to, CfgEdgeType type, int line,
                         Set<String> known, Set<String> unresolved) {
        boolean resolved = known.contains(to);
        if (!resolved) {
            unresolved.add(to);
        }
        edges.add(new CfgEdge(from, to, type, line, resolved));
    }

    private static boolean isExitProgram(Statement statement) {
        return statement.getKind() == StatementKind.EXIT && statement.getContent().contains("PROGRAM");
    }
}
