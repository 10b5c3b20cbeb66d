package com.mainframe.analyzer.pipeline;

import com.mainframe.analyzer.config.AnalyzerConfig;
import com.mainframe.analyzer.graph.call.CallGraph;
import com.mainframe.analyzer.graph.call.CallGraphBuilder;
import com.mainframe.analyzer.graph.cfg.ControlFlowGraph;
import com.mainframe.analyzer.graph.cfg.ControlFlowGraphBuilder;
import com.mainframe.analyzer.hierarchy.DataSectionSummarizer;
import com.mainframe.analyzer.impact.AnalysisGraphStore;
import com.mainframe.analyzer.lineage.CopybookDependency;
import com.mainframe.analyzer.lineage.CopybookDependencyAnalyzer;
import com.mainframe.analyzer.lineage.DataLineageAnalyzer;
import com.mainframe.analyzer.lineage.FileIoMap;
import com.mainframe.analyzer.lineage.ProgramLineage;
import com.mainframe.analyzer.lineage.WhereUsedIndex;
import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.ProgramKind;
import com.mainframe.analyzer.parser.NormalizedSource;
import com.mainframe.analyzer.parser.SourceNormalizer;
import com.mainframe.analyzer.parser.StructuralParser;
import com.mainframe.analyzer.rules.BusinessRuleExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the analysis of a batch of sources.
 *
 * Files are parsed independently on a fixed pool of workers. Once every worker has finished,
 * the cross-program stages (call graph merge, lineage, copybook dependencies, business rules) run
 * on the calling thread and the resulting graph is published to the {@link AnalysisGraphStore}.
 */
public class AnalysisPipeline {
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalyzerConfig config;
    private final AnalysisGraphStore store;
    private final StructuralParser parser = new StructuralParser();
    private final ControlFlowGraphBuilder cfgBuilder = new ControlFlowGraphBuilder();
    private final CallGraphBuilder callGraphBuilder = new CallGraphBuilder();
    private final DataLineageAnalyzer lineageAnalyzer = new DataLineageAnalyzer();
    private final CopybookDependencyAnalyzer copybookAnalyzer = new CopybookDependencyAnalyzer();
    private final BusinessRuleExtractor ruleExtractor = new BusinessRuleExtractor();
    private final DataSectionSummarizer summarizer = new DataSectionSummarizer();

    public AnalysisPipeline(AnalyzerConfig config) {
        this(config, new AnalysisGraphStore());
    }

    public AnalysisPipeline(AnalyzerConfig config, AnalysisGraphStore store) {
        this.config = config;
        this.store = store;
    }

    public AnalysisGraphStore getStore() {
        return store;
    }

    public BatchAnalysis analyze(List<SourceUnit> sources) {
        log.info("Analyzing {} source files with {} workers", sources.size(), config.getParallelism());
        List<ParsedUnit> parsed = parseAll(sources);
        return store.publish(assemble(parsed));
    }

    /**
     * Re-parses one source, replaces the program with the same id (or adds it) and publishes a
     * refreshed graph. Requires a previous {@link #analyze} on this pipeline.
     */
    public BatchAnalysis reanalyze(SourceUnit source) {
        BatchAnalysis previous = store.currentBatch()
                .orElseThrow(() -> new IllegalStateException("reanalyze requires a previous analysis"));
        ParsedUnit changed = parseOne(source);
        String changedId = changed.program.getProgramId();

        List<ParsedUnit> units = new ArrayList<>();
        boolean replaced = false;
        for (SemanticAnalysisResult result : previous.getResults()) {
            if (result.getProgramId().equals(changedId)) {
                units.add(changed);
                replaced = true;
            } else {
                units.add(new ParsedUnit(result.getParsedModel(), result.getControlFlowGraph()));
            }
        }
        if (!replaced) {
            units.add(changed);
        }
        log.info("Re-analyzed {} ({}), refreshing graph", changedId, replaced ? "replaced" : "added");
        return store.publish(assemble(units));
    }

    private List<ParsedUnit> parseAll(List<SourceUnit> sources) {
        List<Callable<ParsedUnit>> tasks = new ArrayList<>();
        for (SourceUnit source : sources) {
            tasks.add(() -> parseOne(source));
        }

        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, config.getParallelism()));
        try {
            List<Future<ParsedUnit>> futures = workers.invokeAll(tasks);
            List<ParsedUnit> parsed = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    parsed.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    parsed.add(failed(sources.get(i), e.getCause()));
                }
            }
            return parsed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } finally {
            workers.shutdownNow();
        }
    }

    /**
     * Normalize, parse and build the control flow graph of one file. Never throws: a failure
     * yields an empty program carrying the error.
     */
    ParsedUnit parseOne(SourceUnit source) {
        try {
            NormalizedSource normalized = new SourceNormalizer(config.getSourceFormat())
                    .normalize(source.getContent(), source.getFileName());
            Program program = parser.parse(normalized);
            ControlFlowGraph cfg = cfgBuilder.build(program);
            log.debug("Parsed {} as {} ({} paragraphs, {} data items)", source.getFileName(),
                    program.getProgramId(), program.getParagraphs().size(), program.getDataItems().size());
            return new ParsedUnit(program, cfg);
        } catch (RuntimeException e) {
            return failed(source, e);
        }
    }

    private ParsedUnit failed(SourceUnit source, Throwable cause) {
        log.error("Analysis of {} failed", source.getFileName(), cause);
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics(source.getFileName());
        diagnostics.error(0, "Analysis failed: " + cause);
        Program program = Program.builder()
                .programId(StructuralParser.programIdFromFileName(source.getFileName()))
                .fileName(source.getFileName())
                .kind(ProgramKind.PROGRAM)
                .diagnostics(diagnostics)
                .build();
        return new ParsedUnit(program, cfgBuilder.build(program));
    }

    private BatchAnalysis assemble(List<ParsedUnit> parsed) {
        List<ParsedUnit> units = new ArrayList<>();
        List<Program> programs = new ArrayList<>();
        for (ParsedUnit unit : parsed) {
            if (config.isIncludeCopybookPrograms() || !unit.program.isCopybook()) {
                units.add(unit);
                // batch-level warnings go to a copy so parsed programs and earlier snapshots stay as they were
                programs.add(unit.program.toBuilder().diagnostics(unit.program.getDiagnostics().copy()).build());
            }
        }

        CallGraph merged = callGraphBuilder.merge(programs);
        List<CopybookDependency> copybooks = copybookAnalyzer.analyze(programs);
        Set<String> batchIds = new LinkedHashSet<>();
        for (Program program : programs) {
            if (!program.isCopybook()) {
                batchIds.add(program.getProgramId());
            }
        }

        BatchAnalysis.BatchAnalysisBuilder batch = BatchAnalysis.builder()
                .callGraph(merged)
                .copybookDependencies(copybooks);
        List<WhereUsedIndex> indexes = new ArrayList<>();
        List<FileIoMap> fileMaps = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            ParsedUnit unit = units.get(i);
            Program program = programs.get(i);
            ProgramLineage lineage = lineageAnalyzer.analyze(program);
            indexes.add(lineage.getWhereUsed());
            fileMaps.add(lineage.getFileIo());

            SemanticAnalysisResult.SemanticAnalysisResultBuilder result = SemanticAnalysisResult.builder()
                    .programModel(program)
                    .parsedModel(unit.program)
                    .controlFlowGraph(unit.cfg)
                    .callGraph(callGraphBuilder.build(program, batchIds))
                    .dataLineage(lineage.getLineage())
                    .fileIoMap(lineage.getFileIo())
                    .whereUsedIndex(lineage.getWhereUsed())
                    .businessRules(ruleExtractor.extract(program))
                    .workingStorage(summarizer.summarizeWorkingStorage(program))
                    .linkage(summarizer.summarizeLinkage(program));
            for (CopybookDependency dependency : copybooks) {
                if (dependency.getUsedBy().contains(program.getProgramId())) {
                    result.copybookDependency(dependency);
                }
            }
            batch.result(result.build());
        }

        BatchAnalysis assembled = batch
                .whereUsed(WhereUsedIndex.merge(indexes))
                .fileIo(FileIoMap.merge(fileMaps))
                .build();
        log.info("Batch assembled: {} programs, {} call edges, {} copybooks, {} diagnostics",
                assembled.getResults().size(), merged.getEdges().size(), copybooks.size(),
                assembled.getDiagnosticCount());
        return assembled;
    }

    /**
     * Per-file output of the parallel stage.
     */
    static final class ParsedUnit {
        final Program program;
        final ControlFlowGraph cfg;

        ParsedUnit(Program program, ControlFlowGraph cfg) {
            this.program = program;
            this.cfg = cfg;
        }
    }
}
