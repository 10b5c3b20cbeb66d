package com.mainframe.analyzer.pipeline;

import com.mainframe.analyzer.graph.call.CallGraph;
import com.mainframe.analyzer.graph.cfg.ControlFlowGraph;
import com.mainframe.analyzer.hierarchy.LinkageSummary;
import com.mainframe.analyzer.hierarchy.WorkingStorageSummary;
import com.mainframe.analyzer.lineage.CopybookDependency;
import com.mainframe.analyzer.lineage.DataLineage;
import com.mainframe.analyzer.lineage.FileIoMap;
import com.mainframe.analyzer.lineage.WhereUsedIndex;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.rules.BusinessRuleCandidate;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything derived for one program. {@code copybookDependencies} lists only the copybooks this
 * program includes. The diagnostics of {@code programModel} belong to this result alone and include
 * the cross-program warnings of its batch.
 */
@Value
@Builder(toBuilder = true)
public class SemanticAnalysisResult {

    @NonNull
    Program programModel;

    @NonNull
    CallGraph callGraph;

    @NonNull
    DataLineage dataLineage;

    @NonNull
    ControlFlowGraph controlFlowGraph;

    @Singular
    List<BusinessRuleCandidate> businessRules;

    @NonNull
    FileIoMap fileIoMap;

    @Singular
    List<CopybookDependency> copybookDependencies;

    @NonNull
    WhereUsedIndex whereUsedIndex;

    WorkingStorageSummary workingStorage;

    LinkageSummary linkage;

    /**
     * The program as parsing left it, without the warnings of the batch it was assembled into.
     */
    @JsonIgnore
    Program parsedModel;

    @JsonIgnore
    public Program getParsedModel() {
        return parsedModel != null ? parsedModel : programModel;
    }

    public String getProgramId() {
        return programModel.getProgramId();
    }
}
