package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.UsageType;
import com.mainframe.analyzer.parser.DataEntryToken.TokenType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for one DATA DIVISION entry (level number through terminating period).
 *
 * Input is normalized text, so sequence areas, indicators and comments are already gone; the
 * text may span lines joined with '\n', which keeps token line numbers exact.
 */
public class DataEntryTokenizer {
    private static final Logger log = LoggerFactory.getLogger(DataEntryTokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("PIC", TokenType.PIC),
        Map.entry("PICTURE", TokenType.PIC),
        Map.entry("OCCURS", TokenType.OCCURS),
        Map.entry("TO", TokenType.TO),
        Map.entry("TIMES", TokenType.TIMES),
        Map.entry("REDEFINES", TokenType.REDEFINES),
        Map.entry("RENAMES", TokenType.RENAMES),
        Map.entry("VALUE", TokenType.VALUE),
        Map.entry("VALUES", TokenType.VALUE),
        Map.entry("USAGE", TokenType.USAGE),
        Map.entry("DEPENDING", TokenType.DEPENDING),
        Map.entry("ON", TokenType.ON),
        Map.entry("THRU", TokenType.THRU),
        Map.entry("THROUGH", TokenType.THRU),
        Map.entry("IS", TokenType.IS),
        Map.entry("ARE", TokenType.IS),
        Map.entry("FILLER", TokenType.FILLER),
        Map.entry("INDEXED", TokenType.INDEXED),
        Map.entry("KEY", TokenType.KEY),
        Map.entry("BY", TokenType.BY)
    );

    private final String source;
    private int pos = 0;
    private int line;
    private TokenType lastType;

    public DataEntryTokenizer(String entryText, int startLine) {
        this.source = entryText;
        this.line = startLine;
    }

    public List<DataEntryToken> tokenize() {
        List<DataEntryToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            DataEntryToken token = nextToken(tokens.isEmpty());
            if (token != null) {
                tokens.add(token);
                lastType = token.getType();
            }
        }

        tokens.add(new DataEntryToken(TokenType.EOF, "", line));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c) || c == ',' || c == ';') {
                pos++;
            } else {
                break;
            }
        }
    }

    private DataEntryToken nextToken(boolean first) {
        char c = source.charAt(pos);
        int startLine = line;

        if (lastType == TokenType.PIC) {
            skipOptionalIs();
            return pos < source.length() ? readPictureString(line) : null;
        }

        if (c == '.') {
            pos++;
            return new DataEntryToken(TokenType.PERIOD, ".", startLine);
        }
        if (c == '(') {
            pos++;
            return new DataEntryToken(TokenType.LPAREN, "(", startLine);
        }
        if (c == ')') {
            pos++;
            return new DataEntryToken(TokenType.RPAREN, ")", startLine);
        }
        if (c == '\'' || c == '"') {
            return readStringLiteral(c, startLine);
        }
        if (Character.isDigit(c) || ((c == '-' || c == '+') && nextIsDigit())) {
            return readNumberOrWord(first, startLine);
        }
        if (Character.isLetter(c)) {
            return readWord(startLine);
        }

        log.debug("Skipping unexpected character '{}' at line {}", c, startLine);
        pos++;
        return null;
    }

    private void skipOptionalIs() {
        if (source.startsWith("IS", pos) && pos + 2 < source.length()
                && Character.isWhitespace(source.charAt(pos + 2))) {
            pos += 2;
            skipWhitespace();
        }
    }

    private DataEntryToken readPictureString(int startLine) {
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                break;
            }
            // a period followed by whitespace or end of text terminates the entry
            if (c == '.' && (pos + 1 >= source.length() || Character.isWhitespace(source.charAt(pos + 1)))) {
                break;
            }
            sb.append(c);
            pos++;
        }
        return new DataEntryToken(TokenType.PICTURE_STRING, sb.toString(), startLine);
    }

    private DataEntryToken readStringLiteral(char quote, int startLine) {
        StringBuilder sb = new StringBuilder();
        pos++;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                // doubled quote is an escaped quote
                if (pos < source.length() && source.charAt(pos) == quote) {
                    sb.append(quote);
                    pos++;
                } else {
                    break;
                }
            } else if (c == '\n') {
                break;
            } else {
                sb.append(c);
                pos++;
            }
        }

        return new DataEntryToken(TokenType.STRING_LITERAL, sb.toString(), startLine);
    }

    private DataEntryToken readNumberOrWord(boolean first, int startLine) {
        int start = pos;
        if (source.charAt(pos) == '-' || source.charAt(pos) == '+') {
            pos++;
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
                pos++;
            } else {
                break;
            }
        }

        // names may start with a digit, e.g. 1ST-ADDRESS
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '-')) {
            pos = start;
            return readWord(startLine);
        }

        String value = source.substring(start, pos);
        if (first) {
            return new DataEntryToken(TokenType.LEVEL_NUMBER, value, startLine);
        }
        return new DataEntryToken(TokenType.NUMERIC_LITERAL, value, startLine);
    }

    private DataEntryToken readWord(int startLine) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                pos++;
            } else {
                break;
            }
        }

        String value = source.substring(start, pos).toUpperCase();

        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new DataEntryToken(keywordType, value, startLine);
        }
        if (UsageType.isUsageKeyword(value)) {
            return new DataEntryToken(TokenType.USAGE_TYPE, value, startLine);
        }
        return new DataEntryToken(TokenType.IDENTIFIER, value, startLine);
    }

    private boolean nextIsDigit() {
        return pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
    }
}
