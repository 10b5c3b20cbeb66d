package com.mainframe.analyzer.lineage;

import com.mainframe.analyzer.model.CopyDirective;
import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Program;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Relates every copybook named by a COPY directive to the programs that include it.
 *
 * When the copybook's own source is part of the batch its data items and nested COPY
 * directives are recorded; otherwise the including program gets an unresolved-reference
 * warning.
 */
public class CopybookDependencyAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CopybookDependencyAnalyzer.class);

    private static final int FINGERPRINT_LENGTH = 8;

    public List<CopybookDependency> analyze(List<Program> programs) {
        Map<String, Program> copybookSources = new TreeMap<>();
        for (Program program : programs) {
            if (program.isCopybook()) {
                copybookSources.put(program.getProgramId(), program);
            }
        }

        Map<String, Set<String>> usedBy = new TreeMap<>();
        for (Program program : programs) {
            for (CopyDirective copy : program.getCopyDirectives()) {
                usedBy.computeIfAbsent(copy.getCopybookName(), k -> new LinkedHashSet<>()).add(program.getProgramId());
                if (!copybookSources.containsKey(copy.getCopybookName()) && !isSqlInclude(copy)) {
                    program.getDiagnostics().warn(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING, copy.getLineNumber(),
                            "Copybook " + copy.getCopybookName() + " is not part of the analyzed batch");
                }
            }
        }

        List<CopybookDependency> dependencies = new ArrayList<>();
        usedBy.forEach((name, users) -> {
            CopybookDependency.CopybookDependencyBuilder dependency = CopybookDependency.builder()
                    .copybookName(name)
                    .usedBy(users)
                    .fingerprint(fingerprint(name));
            Program source = copybookSources.get(name);
            if (source != null) {
                dependency.resolved(true);
                for (DataItem item : source.getDataItems()) {
                    if (!item.isFiller()) {
                        dependency.definedItem(item.getName());
                    }
                }
                for (CopyDirective nested : source.getCopyDirectives()) {
                    dependency.dependency(nested.getCopybookName());
                }
            }
            dependencies.add(dependency.build());
        });
        log.info("Resolved {} of {} copybooks referenced by the batch",
                dependencies.stream().filter(CopybookDependency::isResolved).count(), dependencies.size());
        return dependencies;
    }

    /**
     * First eight hex digits of the SHA-256 of the copybook name.
     */
    static String fingerprint(String copybookName) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(copybookName.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static boolean isSqlInclude(CopyDirective copy) {
        return "SQL".equals(copy.getLibrary());
    }
}
