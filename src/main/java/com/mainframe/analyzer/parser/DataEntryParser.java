package com.mainframe.analyzer.parser;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.UsageType;
import com.mainframe.analyzer.parser.DataEntryToken.TokenType;

/**
 * Parser for a single DATA DIVISION entry.
 *
 * Parsing only:
 * - Reads level, name, and the REDEFINES / PIC / USAGE / OCCURS / VALUE / RENAMES clauses in any
 *   order
 * - Reports malformed entries as diagnostics
 *
 * It does NOT resolve parents, infer types or compute lengths.
 */
public class DataEntryParser {
    private static final Logger log = LoggerFactory.getLogger(DataEntryParser.class);

    private final List<DataEntryToken> tokens;
    private final DataSection section;
    private final String copybook;
    private int pos = 0;

    public DataEntryParser(List<DataEntryToken> tokens, DataSection section, String copybook) {
        this.tokens = tokens;
        this.section = section;
        this.copybook = copybook;
    }

    /**
     * Tokenize and parse one entry.
     */
    public static Optional<RawDataEntry> parse(String entryText, int lineNumber, DataSection section,
                                               String copybook, AnalysisDiagnostics diagnostics) {
        List<DataEntryToken> tokens = new DataEntryTokenizer(entryText, lineNumber).tokenize();
        return new DataEntryParser(tokens, section, copybook).parse(diagnostics);
    }

    public Optional<RawDataEntry> parse(AnalysisDiagnostics diagnostics) {
        try {
            RawDataEntry entry = parseEntry();
            if (!isAtEnd()) {
                DataEntryToken extra = peek();
                diagnostics.warn(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING, extra.getLine(),
                        "Text after the end of data entry " + entry.getName() + " ignored, starting at " + extra.getValue());
            }
            return Optional.of(entry);
        } catch (ParseException e) {
            diagnostics.warn(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING, e.getLineNumber(), e.getMessage());
            return Optional.empty();
        }
    }

    private RawDataEntry parseEntry() {
        DataEntryToken levelToken = expect(TokenType.LEVEL_NUMBER);
        int level;
        try {
            level = Integer.parseInt(levelToken.getValue());
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid level number " + levelToken.getValue(), levelToken.getLine());
        }
        if (level < 1 || (level > 49 && level != 66 && level != 77 && level != 88)) {
            throw new ParseException("Level number " + level + " out of range", levelToken.getLine());
        }
        int startLine = levelToken.getLine();

        RawDataEntry.RawDataEntryBuilder entry = RawDataEntry.builder()
                .level(level)
                .section(section)
                .lineNumber(startLine)
                .copybook(copybook);

        if (check(TokenType.FILLER)) {
            advance();
            entry.name("FILLER").filler(true);
        } else if (check(TokenType.IDENTIFIER)) {
            entry.name(advance().getValue());
        } else {
            // unnamed elementary item, e.g. "05 PIC X(3)."
            entry.name("FILLER").filler(true);
        }

        if (level == 88) {
            parseConditionValues(entry, startLine);
        } else {
            parseClauses(entry, level, startLine);
        }

        skip(TokenType.PERIOD);

        return entry.build();
    }

    private void parseClauses(RawDataEntry.RawDataEntryBuilder entry, int level, int startLine) {
        while (!isAtEnd() && !check(TokenType.PERIOD)) {
            DataEntryToken token = peek();
            switch (token.getType()) {
                case REDEFINES -> {
                    advance();
                    entry.redefines(expect(TokenType.IDENTIFIER).getValue());
                }
                case RENAMES -> {
                    advance();
                    if (level != 66) {
                        throw new ParseException("RENAMES outside a level 66 entry", token.getLine());
                    }
                    String from = expect(TokenType.IDENTIFIER).getValue();
                    if (check(TokenType.THRU)) {
                        advance();
                        from = from + " THRU " + expect(TokenType.IDENTIFIER).getValue();
                    }
                    entry.renames(from);
                }
                case PIC -> {
                    advance();
                    entry.picture(expect(TokenType.PICTURE_STRING).getValue());
                }
                case USAGE -> {
                    advance();
                    skipIs();
                    entry.usage(UsageType.fromCobol(expect(TokenType.USAGE_TYPE).getValue()));
                }
                case USAGE_TYPE -> entry.usage(UsageType.fromCobol(advance().getValue()));
                case OCCURS -> parseOccurs(entry);
                case VALUE -> {
                    advance();
                    skipIs();
                    parseValueList(entry, startLine);
                }
                case INDEXED -> {
                    advance();
                    skip(TokenType.BY);
                    while (check(TokenType.IDENTIFIER)) {
                        advance();
                    }
                }
                default -> {
                    // JUSTIFIED, SYNC, SIGN, BLANK WHEN ZERO, ASCENDING KEY ... carry no structure
                    log.debug("Ignoring clause token {} at line {}", token.getValue(), token.getLine());
                    advance();
                }
            }
        }
    }

    private void parseOccurs(RawDataEntry.RawDataEntryBuilder entry) {
        DataEntryToken occursToken = advance();
        if (!check(TokenType.NUMERIC_LITERAL)) {
            throw new ParseException("Expected numeric literal after OCCURS", occursToken.getLine());
        }
        int first = parseCount(advance());
        int max = first;
        if (check(TokenType.TO)) {
            advance();
            if (!check(TokenType.NUMERIC_LITERAL)) {
                throw new ParseException("Expected numeric literal after OCCURS ... TO", occursToken.getLine());
            }
            max = parseCount(advance());
            entry.occursMin(first);
        }
        skip(TokenType.TIMES);
        if (check(TokenType.DEPENDING)) {
            advance();
            skip(TokenType.ON);
            entry.occursDependingOn(expect(TokenType.IDENTIFIER).getValue());
        }
        entry.occurs(Math.max(1, max));
    }

    private void parseConditionValues(RawDataEntry.RawDataEntryBuilder entry, int startLine) {
        if (!check(TokenType.VALUE)) {
            throw new ParseException("Expected VALUE clause for level 88 item", startLine);
        }
        advance();
        skipIs();
        parseValueList(entry, startLine);
    }

    private void parseValueList(RawDataEntry.RawDataEntryBuilder entry, int startLine) {
        int count = 0;
        while (isValueToken()) {
            String value = literalText(advance());
            if (check(TokenType.THRU)) {
                advance();
                if (!isValueToken()) {
                    throw new ParseException("Expected literal after THRU", startLine);
                }
                value = value + " THRU " + literalText(advance());
            }
            entry.value(value);
            count++;
        }
        if (count == 0) {
            throw new ParseException("VALUE clause without a literal", startLine);
        }
    }

    private boolean isValueToken() {
        if (isAtEnd()) {
            return false;
        }
        DataEntryToken token = peek();
        return token.isLiteral()
                || (token.is(TokenType.IDENTIFIER) && CobolText.FIGURATIVE_CONSTANTS.contains(token.getValue()));
    }

    private String literalText(DataEntryToken token) {
        // VALUE ALL '*' is one value
        if (token.is(TokenType.IDENTIFIER) && "ALL".equals(token.getValue()) && !isAtEnd() && peek().isLiteral()) {
            return "ALL " + advance().getValue();
        }
        return token.getValue();
    }

    private static int parseCount(DataEntryToken token) {
        try {
            return Integer.parseInt(token.getValue());
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid OCCURS count " + token.getValue(), token.getLine());
        }
    }

    private void skipIs() {
        skip(TokenType.IS);
    }

    private void skip(TokenType type) {
        if (check(type)) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private DataEntryToken peek() {
        return tokens.get(pos);
    }

    private DataEntryToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private DataEntryToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private DataEntryToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException("Expected " + type + " but found " + peek().getType(), peek().getLine());
    }
}
