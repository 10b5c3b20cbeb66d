package com.mainframe.analyzer.cli.output;

import com.mainframe.analyzer.cli.model.ValidatedOptions;
import com.mainframe.analyzer.impact.FieldImpactAnalysis;
import com.mainframe.analyzer.impact.ImpactReport;
import com.mainframe.analyzer.impact.ImpactedItem;
import com.mainframe.analyzer.impact.InstantImpact;
import com.mainframe.analyzer.lineage.Reference;
import com.mainframe.analyzer.model.Diagnostic;
import com.mainframe.analyzer.pipeline.BatchAnalysis;
import com.mainframe.analyzer.pipeline.SemanticAnalysisResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Responsible only for printing CLI output. No validation, no analysis.
 */
public class AnalysisResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultsPrinter.class);

    public void printBanner(String command, ValidatedOptions v) {
        log.info("=================================================");
        log.info("COBOL Static Analyzer: {}", command);
        log.info("=================================================");
        log.info("Source Directory: {}", v.getNormalizedSourceDir());
        log.info("Source Format: {}", v.getConfig().getSourceFormat());
        log.info("Workers: {}", v.getConfig().getParallelism());
        log.info("=================================================");
    }

    public void printSummary(BatchAnalysis batch) {
        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS COMPLETE (graph v{})", batch.getGraphVersion());
        log.info("=================================================");
        for (SemanticAnalysisResult result : batch.getResults()) {
            log.info("{} [{}] paragraphs={} dataItems={} complexity={} rules={}",
                    result.getProgramId(),
                    result.getProgramModel().getKind(),
                    result.getProgramModel().getParagraphs().size(),
                    result.getProgramModel().getDataItems().size(),
                    result.getControlFlowGraph().getCyclomaticComplexity(),
                    result.getBusinessRules().size());
        }
        log.info("");
        log.info("Call edges: {}", batch.getCallGraph().getEdges().size());
        log.info("Entry points: {}", String.join(", ", batch.getCallGraph().getEntryPoints()));
        if (!batch.getCallGraph().getUnresolvedCalls().isEmpty()) {
            log.info("Unresolved calls: {}", String.join(", ", batch.getCallGraph().getUnresolvedCalls()));
        }
        log.info("Copybooks referenced: {}", batch.getCopybookDependencies().size());
        log.info("Files accessed: {}", batch.getFileIo().getCrudMatrix().getFiles().size());
        printDiagnostics(batch);
    }

    public void printImpact(ImpactReport report) {
        log.info("");
        log.info("=================================================");
        log.info("IMPACT OF {} (graph v{})", report.getSource(), report.getGraphVersion());
        log.info("=================================================");
        if (!report.isFound()) {
            log.warn("{} is not part of the analyzed batch", report.getSource());
            return;
        }
        printItems("Direct", report.getDirect());
        printItems("Indirect", report.getIndirect());
        printItems("Cascading", report.getCascading());
        log.info("");
        log.info("Total impacted: {}", report.getMetrics().getTotalImpacted());
        log.info("High risk changes: {}", report.getMetrics().getHighRiskChanges());
        log.info("Estimated testing effort: {} hours", report.getMetrics().getEstimatedTestingEffortHours());
        log.info("Recommended approach: {}", report.getMetrics().getRecommendedApproach());
        if (report.isTruncated()) {
            log.warn("Result truncated: depth limit, external dependency or deadline reached");
        }
    }

    public void printInstant(InstantImpact impact) {
        if (!impact.isFound()) {
            log.warn("{} is not part of the analyzed batch", impact.getSource());
            return;
        }
        log.info("{}: {}", impact.getSource(), impact.getSummary());
    }

    public void printFieldImpact(FieldImpactAnalysis analysis) {
        log.info("");
        log.info("Field {}: defined in {}", analysis.getFieldName(),
                analysis.getDefinedIn().isEmpty() ? "unknown" : String.join(", ", analysis.getDefinedIn()));
        for (Reference usage : analysis.getUsages()) {
            log.info("  {} {}:{} ({})", usage.getContext(), usage.getProgram(), usage.getLineNumber(),
                    usage.getLocation());
        }
        for (List<String> chain : analysis.getPropagationChains()) {
            log.info("  flows: {}", String.join(" -> ", chain));
        }
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    private void printItems(String title, List<ImpactedItem> items) {
        if (items.isEmpty()) {
            return;
        }
        log.info("{} ({}):", title, items.size());
        for (ImpactedItem item : items) {
            log.info("  [{}] {} - {}", item.getSeverity(), item.getEntity(), item.getRelationship());
        }
    }

    private void printDiagnostics(BatchAnalysis batch) {
        int shown = 0;
        for (SemanticAnalysisResult result : batch.getResults()) {
            for (Diagnostic error : result.getProgramModel().getDiagnostics().getErrors()) {
                log.error("{}", error);
            }
            for (Diagnostic warning : result.getProgramModel().getDiagnostics().getWarnings()) {
                log.warn("{}", warning);
                shown++;
            }
        }
        if (shown > 0) {
            log.info("{} warnings reported", shown);
        }
    }
}
