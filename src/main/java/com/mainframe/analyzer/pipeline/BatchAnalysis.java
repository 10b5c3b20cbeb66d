package com.mainframe.analyzer.pipeline;

import com.mainframe.analyzer.graph.call.CallGraph;
import com.mainframe.analyzer.lineage.CopybookDependency;
import com.mainframe.analyzer.lineage.FileIoMap;
import com.mainframe.analyzer.lineage.WhereUsedIndex;
import com.mainframe.analyzer.model.Program;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Results of one pipeline run over a set of sources, merged across programs.
 */
@Value
@Builder(toBuilder = true)
public class BatchAnalysis {

    @Singular
    List<SemanticAnalysisResult> results;

    @NonNull
    CallGraph callGraph;

    @NonNull
    WhereUsedIndex whereUsed;

    @NonNull
    FileIoMap fileIo;

    @Singular
    List<CopybookDependency> copybookDependencies;

    /**
     * Version of the analysis graph published for this batch, 0 before publication.
     */
    long graphVersion;

    @JsonIgnore
    public List<Program> getPrograms() {
        List<Program> programs = new ArrayList<>();
        for (SemanticAnalysisResult result : results) {
            programs.add(result.getProgramModel());
        }
        return programs;
    }

    public Optional<SemanticAnalysisResult> findResult(String programId) {
        return results.stream().filter(r -> r.getProgramId().equalsIgnoreCase(programId)).findFirst();
    }

    @JsonIgnore
    public int getDiagnosticCount() {
        int count = 0;
        for (SemanticAnalysisResult result : results) {
            count += result.getProgramModel().getDiagnostics().getWarnings().size()
                    + result.getProgramModel().getDiagnostics().getErrors().size();
        }
        return count;
    }
}
