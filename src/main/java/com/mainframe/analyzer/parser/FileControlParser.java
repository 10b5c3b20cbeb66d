package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.AccessMode;
import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.FileDefinition;
import com.mainframe.analyzer.model.FileOrganization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Reads FILE-CONTROL SELECT sentences.
 */
public class FileControlParser {
    private static final Logger log = LoggerFactory.getLogger(FileControlParser.class);

    /**
     * Parse one SELECT sentence. The result has no record layout yet; the FD entry supplies it.
     */
    public Optional<FileDefinition> parseSelect(String sentence, int lineNumber,
                                           AnalysisDiagnostics diagnostics) {
        List<String> tokens = CobolText.tokenize(sentence);
        for (int i = 0; i < tokens.size(); i++) {
            tokens.set(i, CobolText.stripTerminator(tokens.get(i)));
        }
        tokens.removeIf(String::isEmpty);

        if (tokens.isEmpty() || !tokens.get(0).equals("SELECT")) {
            return Optional.empty();
        }
        int pos = 1;
        if (pos < tokens.size() && tokens.get(pos).equals("OPTIONAL")) {
            pos++;
        }
        if (pos >= tokens.size()) {
            diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, lineNumber, "SELECT without a file name");
            return Optional.empty();
        }

        FileDefinition.FileDefinitionBuilder builder = FileDefinition.builder()
                .name(tokens.get(pos))
                .lineNumber(lineNumber);

        for (int i = pos + 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            switch (token) {
                case "ASSIGN" -> {
                    i = skip(tokens, i + 1, "TO", "USING");
                    if (i < tokens.size()) {
                        builder.assignTo(CobolText.unquote(tokens.get(i)));
                    }
                }
                case "ORGANIZATION" -> {
                    i = skip(tokens, i + 1, "IS");
                    if (i < tokens.size()) {
                        String organization = tokens.get(i);
                        if (organization.equals("LINE") && i + 1 < tokens.size()) {
                            organization = "LINE-SEQUENTIAL";
                            i++;
                        }
                        builder.organization(FileOrganization.fromCobol(organization));
                    }
                }
                case "ACCESS" -> {
                    i = skip(tokens, i + 1, "MODE", "IS");
                    if (i < tokens.size()) {
                        builder.accessMode(AccessMode.fromCobol(tokens.get(i)));
                    }
                }
                case "ALTERNATE" -> {
                    i = skip(tokens, i + 1, "RECORD", "KEY", "IS");
                    if (i < tokens.size()) {
                        builder.alternateKey(tokens.get(i));
                    }
                    i = skip(tokens, i + 1, "WITH", "DUPLICATES") - 1;
                }
                case "RECORD" -> {
                    i = skip(tokens, i + 1, "KEY", "IS");
                    if (i < tokens.size()) {
                        builder.recordKey(tokens.get(i));
                    }
                }
                case "STATUS" -> {
                    i = skip(tokens, i + 1, "IS");
                    if (i < tokens.size()) {
                        builder.fileStatus(tokens.get(i));
                    }
                }
                default -> log.debug("Ignoring SELECT token {} at line {}", token, lineNumber);
            }
        }
        return Optional.of(builder.build());
    }

    private static int skip(List<String> tokens, int from, String... optionalWords) {
        int i = from;
        boolean skipped = true;
        while (skipped && i < tokens.size()) {
            skipped = false;
            for (String word : optionalWords) {
                if (tokens.get(i).equals(word)) {
                    i++;
                    skipped = true;
                    break;
                }
            }
        }
        return i;
    }
}
