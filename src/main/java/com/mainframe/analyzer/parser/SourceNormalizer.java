package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.SourceMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw COBOL text into logical program lines.
 *
 * Fixed format: columns 1-6 sequence area (ignored), column 7 indicator (* or / comment,
 * D debug line treated as comment, - continuation), columns 8-72 program area, columns 73-80
 * identification area (ignored). Free format: {@code *>} starts a comment, a leading {@code *}
 * comments out the whole line.
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    private static final int INDICATOR_COLUMN = 6;
    private static final int PROGRAM_AREA_END = 72;

    private final SourceFormat format;

    public SourceNormalizer() {
        this(SourceFormat.AUTO);
    }

    public SourceNormalizer(SourceFormat format) {
        this.format = format == null ? SourceFormat.AUTO : format;
    }

    public NormalizedSource normalize(String sourceText, String fileName) {
        String[] physical = splitLines(sourceText == null ? "" : sourceText);
        SourceFormat effective = format == SourceFormat.AUTO ? detectFormat(physical) : format;
        log.debug("Normalizing {} ({} lines) as {}", fileName, physical.length, effective);

        LineCollector collector = new LineCollector();
        for (int i = 0; i < physical.length; i++) {
            int lineNumber = i + 1;
            if (effective == SourceFormat.FIXED) {
                fixedLine(physical[i], lineNumber, collector);
            } else {
                freeLine(physical[i], lineNumber, collector);
            }
        }

        return NormalizedSource.builder()
                .fileName(fileName)
                .format(effective)
                .lines(collector.build())
                .metrics(SourceMetrics.builder()
                        .totalLines(physical.length)
                        .codeLines(collector.code)
                        .commentLines(collector.comments)
                        .blankLines(collector.blanks)
                        .build())
                .build();
    }

    /**
     * Fixed when most non-blank lines carry a numeric or blank sequence area followed by a known
     * indicator character.
     */
    SourceFormat detectFormat(String[] lines) {
        int nonBlank = 0;
        int fixedShaped = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            nonBlank++;
            if (looksFixed(line)) {
                fixedShaped++;
            }
        }
        if (nonBlank == 0) {
            return SourceFormat.FIXED;
        }
        return fixedShaped * 2 > nonBlank ? SourceFormat.FIXED : SourceFormat.FREE;
    }

    private boolean looksFixed(String line) {
        if (line.length() <= INDICATOR_COLUMN) {
            return line.chars().allMatch(c -> c == ' ' || Character.isDigit(c));
        }
        for (int i = 0; i < INDICATOR_COLUMN; i++) {
            char c = line.charAt(i);
            if (c != ' ' && !Character.isDigit(c)) {
                return false;
            }
        }
        char indicator = line.charAt(INDICATOR_COLUMN);
        return indicator == ' ' || indicator == '*' || indicator == '/' || indicator == '-'
                || indicator == 'D' || indicator == 'd';
    }

    private void fixedLine(String line, int lineNumber, LineCollector collector) {
        if (line.length() <= INDICATOR_COLUMN) {
            collector.blanks++;
            return;
        }
        char indicator = line.charAt(INDICATOR_COLUMN);
        if (indicator == '*' || indicator == '/' || indicator == 'D' || indicator == 'd') {
            collector.comments++;
            return;
        }
        String programArea = line.length() > INDICATOR_COLUMN + 1
                ? line.substring(INDICATOR_COLUMN + 1, Math.min(PROGRAM_AREA_END, line.length()))
                : "";
        if (programArea.isBlank()) {
            collector.blanks++;
            return;
        }
        collector.code++;
        if (indicator == '-') {
            collector.continueLast(programArea.strip(), lineNumber);
        } else {
            collector.add(programArea.stripTrailing(), lineNumber);
        }
    }

    private void freeLine(String line, int lineNumber, LineCollector collector) {
        if (line.isBlank()) {
            collector.blanks++;
            return;
        }
        String trimmed = line.stripLeading();
        if (trimmed.startsWith("*")) {
            collector.comments++;
            return;
        }
        int inlineComment = CobolText.indexOutsideLiterals(line, "*>");
        String code = inlineComment >= 0 ? line.substring(0, inlineComment) : line;
        if (code.isBlank()) {
            collector.comments++;
            return;
        }
        collector.code++;
        collector.add(code.stripTrailing(), lineNumber);
    }

    private static String[] splitLines(String text) {
        if (text.isEmpty()) {
            return new String[0];
        }
        String[] lines = text.split("\r?\n", -1);
        if (lines.length > 0 && lines[lines.length - 1].isEmpty()) {
            String[] trimmed = new String[lines.length - 1];
            System.arraycopy(lines, 0, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return lines;
    }

    private static final class LineCollector {
        private final List<StringBuilder> texts = new ArrayList<>();
        private final List<Integer> numbers = new ArrayList<>();
        private final List<Boolean> continued = new ArrayList<>();
        int code;
        int comments;
        int blanks;

        void add(String text, int lineNumber) {
            texts.add(new StringBuilder(text));
            numbers.add(lineNumber);
            continued.add(false);
        }

        void continueLast(String text, int lineNumber) {
            if (texts.isEmpty()) {
                log.debug("Continuation at line {} has nothing to continue", lineNumber);
                add(text, lineNumber);
                return;
            }
            int last = texts.size() - 1;
            StringBuilder previous = texts.get(last);
            // a continued literal resumes after the quote that opens the continuation line
            if (CobolText.hasOpenLiteral(previous.toString())
                    && (text.startsWith("'") || text.startsWith("\""))) {
                previous.append(text.substring(1));
            } else {
                previous.append(text);
            }
            continued.set(last, true);
        }

        List<NormalizedLine> build() {
            List<NormalizedLine> lines = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                lines.add(new NormalizedLine(numbers.get(i),
                        CobolText.upperOutsideLiterals(texts.get(i).toString()), continued.get(i)));
            }
            return lines;
        }
    }
}
