package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.hierarchy.DataHierarchyResolver;
import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.CopyDirective;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.Division;
import com.mainframe.analyzer.model.DivisionName;
import com.mainframe.analyzer.model.FileDefinition;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.ProgramKind;
import com.mainframe.analyzer.model.Section;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.GoToPayload;
import com.mainframe.analyzer.model.payload.PerformPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the structural model of one program from normalized lines.
 *
 * Recognizes divisions, sections, paragraphs and statements, FILE-CONTROL and FD entries, COPY
 * directives and DATA DIVISION entries. Problems are reported to the program's diagnostics and
 * never abort the parse. Instances are stateless and safe to share between threads.
 */
public class StructuralParser {
    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private static final Pattern DIVISION_HEADER =
            Pattern.compile("^(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION\\b\\s*(.*)$");
    private static final Pattern SECTION_HEADER = Pattern.compile("^([A-Z0-9][A-Z0-9-]*)\\s+SECTION\\s*\\.?\\s*$");
    private static final Pattern PARAGRAPH_HEADER = Pattern.compile("^([A-Z0-9][A-Z0-9-]*)\\.(?:\\s+(.*))?$");
    private static final Pattern PROGRAM_ID = Pattern.compile("^PROGRAM-ID\\s*\\.?\\s*([^\\s.]+)");
    private static final Pattern METADATA =
            Pattern.compile("^(AUTHOR|INSTALLATION|DATE-WRITTEN|DATE-COMPILED|SECURITY|REMARKS)\\s*\\.\\s*(.*)$");
    private static final Pattern COPY_STATEMENT =
            Pattern.compile("^COPY\\s+([^\\s.]+)(?:\\s+(?:OF|IN)\\s+([^\\s.]+))?");
    private static final Pattern SQL_INCLUDE = Pattern.compile("^EXEC\\s+SQL\\s+INCLUDE\\s+([A-Z0-9-]+)");
    private static final Pattern LEVEL_START = Pattern.compile("^\\d{1,2}(\\s|\\.|$)");
    private static final int AREA_B_OFFSET = 4;

    private final StatementClassifier classifier;
    private final FileControlParser fileControlParser;
    private final DataHierarchyResolver hierarchyResolver;

    public StructuralParser() {
        this(new StatementClassifier(), new FileControlParser(), new DataHierarchyResolver());
    }

    public StructuralParser(StatementClassifier classifier, FileControlParser fileControlParser,
                            DataHierarchyResolver hierarchyResolver) {
        this.classifier = classifier;
        this.fileControlParser = fileControlParser;
        this.hierarchyResolver = hierarchyResolver;
    }

    public Program parse(NormalizedSource source) {
        return new ParseRun(source).run();
    }

    /**
     * Program id used when PROGRAM-ID is missing: the file name without directories or extension.
     */
    public static String programIdFromFileName(String fileName) {
        String name = fileName == null ? "UNKNOWN" : fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name.isEmpty() ? "UNKNOWN" : name.toUpperCase();
    }

    /**
     * Mutable state of a single parse.
     */
    private final class ParseRun {
        private final NormalizedSource source;
        private final AnalysisDiagnostics diagnostics;

        private final Map<DivisionName, Division.DivisionBuilder> divisions = new LinkedHashMap<>();
        private final List<Section.SectionBuilder> sections = new ArrayList<>();
        private final List<Paragraph.ParagraphBuilder> paragraphs = new ArrayList<>();
        private final Map<String, Integer> paragraphCounts = new HashMap<>();
        private final List<RawDataEntry> entries = new ArrayList<>();
        private final Map<String, FileDefinition.FileDefinitionBuilder> files = new LinkedHashMap<>();
        private final List<CopyDirective> copyDirectives = new ArrayList<>();
        private final List<String> procedureUsing = new ArrayList<>();

        private String programId;
        private DivisionName division;
        private Section.SectionBuilder section;
        private String sectionName;
        private DataSection dataSection;
        private FileDefinition.FileDefinitionBuilder currentFd;
        private Paragraph.ParagraphBuilder paragraph;
        private boolean sectionAwaitingParagraph;

        private final StringBuilder sentence = new StringBuilder();
        private int sentenceLine;

        private StringBuilder statement;
        private int statementLine;
        private boolean inExec;

        ParseRun(NormalizedSource source) {
            this.source = source;
            this.diagnostics = new AnalysisDiagnostics(source.getFileName());
        }

        Program run() {
            for (NormalizedLine line : source.getLines()) {
                String text = line.getText();
                String trimmed = text.trim();
                processLine(trimmed, text.length() - text.stripLeading().length(), line.getLineNumber());
            }
            flushSentence();
            flushStatement();

            ProgramKind kind = divisions.isEmpty() ? ProgramKind.COPYBOOK : ProgramKind.PROGRAM;
            if (programId == null) {
                programId = programIdFromFileName(source.getFileName());
                if (kind == ProgramKind.PROGRAM) {
                    diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, 0,
                            "PROGRAM-ID not found, using " + programId);
                }
            }
            if (kind == ProgramKind.COPYBOOK) {
                tagCopybookEntries();
            }

            Program.ProgramBuilder program = Program.builder()
                    .programId(programId)
                    .fileName(source.getFileName())
                    .kind(kind)
                    .metrics(source.getMetrics())
                    .diagnostics(diagnostics)
                    .dataItems(hierarchyResolver.resolve(entries, diagnostics))
                    .copyDirectives(copyDirectives)
                    .procedureUsing(procedureUsing);
            divisions.values().forEach(d -> program.division(d.build()));
            sections.forEach(s -> program.section(s.build()));
            paragraphs.forEach(p -> program.paragraph(p.build()));
            files.values().forEach(f -> program.fileDefinition(f.build()));

            log.debug("Parsed {} ({}): {} paragraphs, {} data items", programId, kind,
                    paragraphs.size(), entries.size());
            return program.build();
        }

        private void processLine(String text, int indent, int lineNumber) {
            if (text.isEmpty()) {
                return;
            }

            if (!inExec) {
                Matcher divisionMatcher = DIVISION_HEADER.matcher(text);
                if (divisionMatcher.find()) {
                    startDivision(DivisionName.fromCobol(divisionMatcher.group(1)), divisionMatcher.group(2), lineNumber);
                    return;
                }
                Matcher sectionMatcher = SECTION_HEADER.matcher(text);
                if (sectionMatcher.matches() && division != DivisionName.IDENTIFICATION) {
                    startSection(sectionMatcher.group(1), lineNumber);
                    return;
                }
            }

            if (division == null) {
                // a member with no divisions is a copybook: data entries only
                if (LEVEL_START.matcher(text).find() || text.startsWith("COPY ") || sentence.length() > 0) {
                    if (dataSection == null) {
                        dataSection = DataSection.WORKING_STORAGE;
                    }
                    appendDataText(text, lineNumber);
                } else {
                    diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, lineNumber,
                            "Text outside any division: " + text);
                }
                return;
            }

            switch (division) {
                case IDENTIFICATION -> identificationLine(text, lineNumber);
                case ENVIRONMENT, DATA -> appendDataText(text, lineNumber);
                case PROCEDURE -> procedureLine(text, indent, lineNumber);
            }
        }

        private void startDivision(DivisionName name, String rest, int lineNumber) {
            flushSentence();
            flushStatement();
            closeParagraph();
            division = name;
            section = null;
            sectionName = null;
            dataSection = null;
            currentFd = null;
            sectionAwaitingParagraph = false;
            divisions.computeIfAbsent(name, n -> Division.builder().name(n).lineNumber(lineNumber));

            if (name == DivisionName.PROCEDURE && rest != null) {
                String using = rest.replaceAll("\\.$", "").trim();
                if (using.startsWith("USING")) {
                    for (String token : CobolText.tokenize(using.substring("USING".length()))) {
                        String parameter = CobolText.stripTerminator(token);
                        if (CobolText.isIdentifier(parameter)) {
                            procedureUsing.add(parameter);
                        }
                    }
                }
            }
        }

        private void startSection(String name, int lineNumber) {
            flushSentence();
            flushStatement();
            closeParagraph();
            section = Section.builder().name(name).division(division).lineNumber(lineNumber);
            sections.add(section);
            sectionName = name;
            currentFd = null;
            divisions.get(division).section(name);

            if (division == DivisionName.DATA) {
                dataSection = DataSection.fromCobol(name);
                if (dataSection == null) {
                    diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, lineNumber,
                            "Unknown DATA DIVISION section " + name);
                }
            } else if (division == DivisionName.PROCEDURE) {
                sectionAwaitingParagraph = true;
            }
        }

        private void identificationLine(String text, int lineNumber) {
            Matcher programIdMatcher = PROGRAM_ID.matcher(text);
            if (programIdMatcher.find()) {
                programId = CobolText.unquote(CobolText.stripTerminator(programIdMatcher.group(1))).toUpperCase();
                return;
            }
            Matcher metadataMatcher = METADATA.matcher(text);
            if (metadataMatcher.find()) {
                String value = metadataMatcher.group(2).trim();
                if (value.endsWith(".")) {
                    value = value.substring(0, value.length() - 1).trim();
                }
                divisions.get(DivisionName.IDENTIFICATION).metadataEntry(metadataMatcher.group(1), value);
            }
        }

        // ---------------------------------------------------------------- ENVIRONMENT and DATA

        /**
         * Accumulate ENVIRONMENT and DATA text, flushing one sentence per terminating period. A line
         * may hold several entries, e.g. {@code 01 A. 05 B PIC X.}
         */
        private void appendDataText(String text, int lineNumber) {
            String rest = text;
            while (!rest.isEmpty()) {
                boolean openLiteral = CobolText.hasOpenLiteral(sentence.toString());
                int end = openLiteral ? -1 : sentenceEnd(rest);
                String piece = end < 0 ? rest : rest.substring(0, end + 1);
                rest = end < 0 ? "" : rest.substring(end + 1).trim();

                if (sentence.length() == 0) {
                    sentenceLine = lineNumber;
                } else {
                    sentence.append('\n');
                }
                sentence.append(piece);
                if (endsSentence(sentence)) {
                    flushSentence();
                }
            }
        }

        private void flushSentence() {
            if (sentence.length() == 0) {
                return;
            }
            String text = sentence.toString().trim();
            int line = sentenceLine;
            sentence.setLength(0);

            if (tryCopy(text, line)) {
                return;
            }
            if (division == DivisionName.ENVIRONMENT) {
                environmentSentence(text, line);
            } else {
                dataSentence(text, line);
            }
        }

        private void environmentSentence(String text, int line) {
            if (text.startsWith("SELECT ")) {
                fileControlParser.parseSelect(text, line, diagnostics)
                        .ifPresent(file -> files.put(file.getName(), file.toBuilder()));
            } else {
                // FILE-CONTROL., SOURCE-COMPUTER. etc.
                log.debug("Skipping ENVIRONMENT DIVISION sentence at line {}", line);
            }
        }

        private void dataSentence(String text, int line) {
            if (text.startsWith("FD ") || text.startsWith("SD ")) {
                List<String> tokens = CobolText.tokenize(text);
                String name = tokens.size() > 1 ? CobolText.stripTerminator(tokens.get(1)) : null;
                if (name == null || name.isEmpty()) {
                    diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, line, "FD without a file name");
                    return;
                }
                currentFd = files.get(name);
                if (currentFd == null) {
                    diagnostics.warn(DiagnosticKind.UNRESOLVED_REFERENCE_WARNING, line,
                            "FD " + name + " has no SELECT entry");
                    currentFd = FileDefinition.builder().name(name).lineNumber(line);
                    files.put(name, currentFd);
                }
                currentFd.sortFile(text.startsWith("SD "));
                return;
            }
            if (!LEVEL_START.matcher(text).find()) {
                diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, line, "Unrecognized data entry: " + text);
                return;
            }
            if (dataSection == null) {
                diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, line,
                        "Data entry outside a known section, assuming WORKING-STORAGE");
                dataSection = DataSection.WORKING_STORAGE;
            }

            DataEntryParser.parse(text, line, dataSection, null, diagnostics).ifPresent(entry -> {
                if (entry.getLevel() == 1 && dataSection == DataSection.FILE && currentFd != null) {
                    currentFd.recordName(entry.getName()).recordItem(entries.size());
                }
                entries.add(entry);
            });
        }

        private boolean tryCopy(String text, int line) {
            Matcher copy = COPY_STATEMENT.matcher(text);
            Matcher include = SQL_INCLUDE.matcher(text);
            if (copy.find()) {
                addCopyDirective(CobolText.unquote(copy.group(1)), copy.group(2), line);
                return true;
            }
            if (include.find()) {
                addCopyDirective(include.group(1), "SQL", line);
                return true;
            }
            return false;
        }

        private void addCopyDirective(String name, String library, int line) {
            copyDirectives.add(CopyDirective.builder()
                    .copybookName(name.toUpperCase())
                    .library(library == null ? null : CobolText.unquote(library))
                    .lineNumber(line)
                    .division(division)
                    .section(sectionName)
                    .build());
            log.debug("COPY {} at line {}", name, line);
        }

        private void tagCopybookEntries() {
            for (int i = 0; i < entries.size(); i++) {
                entries.set(i, entries.get(i).toBuilder().copybook(programId).build());
            }
        }

        // ---------------------------------------------------------------- PROCEDURE

        private void procedureLine(String text, int indent, int lineNumber) {
            if (inExec) {
                statement.append(' ').append(text);
                if (CobolText.indexOutsideLiterals(text, "END-EXEC") >= 0) {
                    inExec = false;
                    if (endsSentence(statement)) {
                        flushStatement();
                    }
                }
                return;
            }

            Matcher header = PARAGRAPH_HEADER.matcher(text);
            // a header follows a full stop or starts in area A; anything else continues a statement
            boolean headerPosition = statement == null || indent < AREA_B_OFFSET;
            if (headerPosition && header.matches() && isParagraphName(header.group(1))) {
                flushStatement();
                startParagraph(header.group(1), lineNumber);
                String remainder = header.group(2);
                if (remainder != null && !remainder.isBlank()) {
                    procedureText(remainder.trim(), lineNumber);
                }
                return;
            }
            procedureText(text, lineNumber);
        }

        /**
         * Split a line into period-terminated pieces and feed each to the statement assembler.
         */
        private void procedureText(String text, int lineNumber) {
            String rest = text;
            while (!rest.isEmpty()) {
                int end = sentenceEnd(rest);
                String piece = end < 0 ? rest : rest.substring(0, end + 1);
                rest = end < 0 ? "" : rest.substring(end + 1).trim();
                procedurePiece(piece.trim(), lineNumber);
            }
        }

        private void procedurePiece(String piece, int lineNumber) {
            if (piece.isEmpty()) {
                return;
            }
            if (piece.equals(".")) {
                if (statement != null) {
                    statement.append('.');
                    flushStatement();
                }
                return;
            }
            String firstWord = CobolText.stripTerminator(CobolText.tokenize(piece).get(0));
            StatementKind kind = StatementKind.fromVerb(firstWord);
            boolean startsStatement = kind != null && kind != StatementKind.OTHER;

            if (startsStatement || statement == null) {
                flushStatement();
                statement = new StringBuilder(piece);
                statementLine = lineNumber;
                if (kind == StatementKind.EXEC && CobolText.indexOutsideLiterals(piece, "END-EXEC") < 0) {
                    inExec = true;
                    return;
                }
            } else {
                statement.append(' ').append(piece);
            }
            if (endsSentence(statement)) {
                flushStatement();
            }
        }

        private void flushStatement() {
            if (statement == null) {
                return;
            }
            if (inExec) {
                diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, statementLine, "EXEC block without END-EXEC");
                inExec = false;
            }
            Statement classified = classifier.classify(statement.toString(), statementLine);
            statement = null;

            if (classified.getKind() == StatementKind.COPY || classified.getKind() == StatementKind.EXEC) {
                tryCopy(classified.getContent(), classified.getLineNumber());
            }

            Paragraph.ParagraphBuilder target = currentParagraph(classified.getLineNumber());
            target.statement(classified);
            PerformPayload perform = classified.payloadAs(PerformPayload.class);
            if (perform != null && perform.getTarget() != null) {
                target.perform(perform.getTarget());
            }
            GoToPayload goTo = classified.payloadAs(GoToPayload.class);
            if (goTo != null) {
                goTo.getTargets().forEach(target::goTo);
            }
        }

        private Paragraph.ParagraphBuilder currentParagraph(int lineNumber) {
            if (paragraph == null) {
                if (sectionAwaitingParagraph) {
                    // statements directly under a section header run as the section's own body
                    startParagraph(sectionName, lineNumber);
                } else {
                    String entryName = programId != null ? programId : programIdFromFileName(source.getFileName());
                    startParagraph(entryName, lineNumber);
                }
            }
            return paragraph;
        }

        private void startParagraph(String name, int lineNumber) {
            closeParagraph();
            int count = paragraphCounts.merge(name, 1, Integer::sum);
            String uniqueName = name;
            if (count > 1) {
                uniqueName = name + "#" + count;
                diagnostics.warn(DiagnosticKind.STRUCTURAL_PARSE_WARNING, lineNumber,
                        "Duplicate paragraph " + name + ", kept as " + uniqueName);
            }
            paragraph = Paragraph.builder()
                    .name(uniqueName)
                    .section(division == DivisionName.PROCEDURE ? sectionName : null)
                    .lineNumber(lineNumber);
            paragraphs.add(paragraph);
            if (section != null && division == DivisionName.PROCEDURE) {
                section.paragraph(uniqueName);
            }
            sectionAwaitingParagraph = false;
        }

        private void closeParagraph() {
            paragraph = null;
        }

        private boolean isParagraphName(String word) {
            if (StatementKind.fromVerb(word) != null || word.startsWith("END-") || word.endsWith("-")) {
                return false;
            }
            return !CobolText.RESERVED_WORDS.contains(word) && !CobolText.FIGURATIVE_CONSTANTS.contains(word);
        }

        private boolean endsSentence(CharSequence text) {
            String s = text.toString().stripTrailing();
            return s.endsWith(".") && !CobolText.hasOpenLiteral(s.substring(0, s.length() - 1));
        }

        /**
         * Index of the first period that ends a sentence (followed by whitespace or end of text,
         * outside literals), or -1.
         */
        private int sentenceEnd(String text) {
            char quote = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '.' && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                    return i;
                }
            }
            return -1;
        }
    }
}
