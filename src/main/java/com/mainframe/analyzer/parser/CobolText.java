package com.mainframe.analyzer.parser;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by the parsers: literal-aware upper-casing and splitting, reserved word
 * and figurative constant tables, identifier extraction.
 */
@UtilityClass
public class CobolText {

    private static final Pattern WORD = Pattern.compile("[A-Z0-9][A-Z0-9-]*");
    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d*\\.?\\d+");

    public static final Set<String> FIGURATIVE_CONSTANTS = Set.of(
            "ZERO", "ZEROS", "ZEROES", "SPACE", "SPACES", "HIGH-VALUE", "HIGH-VALUES",
            "LOW-VALUE", "LOW-VALUES", "QUOTE", "QUOTES", "NULL", "NULLS", "ALL");

    public static final Set<String> RESERVED_WORDS = Set.of(
            // statement verbs
            "ACCEPT", "ADD", "CALL", "CANCEL", "CLOSE", "COMPUTE", "CONTINUE", "COPY", "DELETE",
            "DISPLAY", "DIVIDE", "ELSE", "EVALUATE", "EXEC", "EXIT", "GO", "GOBACK", "IF",
            "INITIALIZE", "INSPECT", "MERGE", "MOVE", "MULTIPLY", "OPEN", "PERFORM", "READ",
            "RELEASE", "RETURN", "REWRITE", "SEARCH", "SET", "SORT", "START", "STOP", "STRING",
            "SUBTRACT", "UNSTRING", "WHEN", "WRITE",
            // clause keywords
            "ADVANCING", "AFTER", "ALSO", "AND", "ANY", "ARE", "AT", "BEFORE", "BY", "CHARACTERS",
            "CONTENT", "CONVERTING", "CORR", "CORRESPONDING", "COUNT", "DATE", "DAY",
            "DAY-OF-WEEK", "DELIMITED", "DELIMITER", "DEPENDING", "END", "EQUAL", "EQUALS",
            "ERROR", "EXCEPTION", "EXTEND", "FALSE", "FIRST", "FOR", "FROM", "GIVING", "GREATER",
            "I-O", "IN", "INITIAL", "INPUT", "INTO", "INVALID", "IS", "KEY", "LEADING", "LESS",
            "LINE", "LINES", "LOCK", "NEXT", "NO", "NOT", "OF", "ON", "OR", "OTHER", "OUTPUT",
            "OVERFLOW", "PAGE", "POINTER", "PROGRAM", "RECORD", "REFERENCE", "REMAINDER",
            "REPLACING", "RETURNING", "ROUNDED", "RUN", "SECTION", "SENTENCE", "SIZE", "TALLYING",
            "TEST", "THAN", "THEN", "THROUGH", "THRU", "TIME", "TIMES", "TO", "TRUE", "UNTIL",
            "UPON", "USING", "VALUE", "VARYING", "WITH", "FUNCTION", "LENGTH", "ADDRESS",
            "REWIND", "REEL", "UNIT", "PREVIOUS",
            // class and sign conditions
            "NUMERIC", "ALPHABETIC", "ALPHABETIC-LOWER", "ALPHABETIC-UPPER", "POSITIVE",
            "NEGATIVE");

    /**
     * Upper-case everything outside quoted literals.
     */
    public static String upperOutsideLiterals(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                sb.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                sb.append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    /**
     * Index of {@code needle} in {@code text} ignoring occurrences inside literals, or -1.
     */
    public static int indexOutsideLiterals(String text, String needle) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (text.startsWith(needle, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * True when the text ends inside an unterminated literal.
     */
    public static boolean hasOpenLiteral(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            }
        }
        return quote != 0;
    }

    /**
     * Replace every quoted literal with a single space.
     */
    public static String stripLiterals(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                    sb.append(' ');
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Split on whitespace, keeping quoted literals (with their quotes) as single tokens.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    public static boolean isQuoted(String token) {
        return token != null && token.length() >= 2
                && (token.charAt(0) == '\'' || token.charAt(0) == '"');
    }

    public static String unquote(String token) {
        if (!isQuoted(token)) {
            return token;
        }
        char quote = token.charAt(0);
        int end = token.charAt(token.length() - 1) == quote ? token.length() - 1 : token.length();
        return token.substring(1, end);
    }

    public static boolean isNumericLiteral(String token) {
        return token != null && NUMBER.matcher(token).matches();
    }

    /**
     * Literal operand: quoted text, a number or a figurative constant.
     */
    public static boolean isLiteral(String token) {
        if (token == null) {
            return false;
        }
        String t = stripTerminator(token);
        return isQuoted(t) || isNumericLiteral(t) || FIGURATIVE_CONSTANTS.contains(t.toUpperCase(Locale.ROOT));
    }

    /**
     * A user-defined word: contains a letter, neither starts nor ends with a hyphen, and is not
     * reserved.
     */
    public static boolean isIdentifier(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        String w = word.toUpperCase(Locale.ROOT);
        if (!WORD.matcher(w).matches() || w.endsWith("-")) {
            return false;
        }
        if (w.chars().noneMatch(Character::isLetter)) {
            return false;
        }
        if (w.startsWith("END-") || RESERVED_WORDS.contains(w) || FIGURATIVE_CONSTANTS.contains(w)) {
            return false;
        }
        return true;
    }

    /**
     * User-defined words in order of appearance, without duplicates; literals are skipped.
     * Subscripts and reference modifiers contribute their own identifiers.
     */
    public static List<String> identifiers(String text) {
        Set<String> result = new LinkedHashSet<>();
        Matcher m = WORD.matcher(stripLiterals(text).toUpperCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (isIdentifier(word)) {
                result.add(word);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Base name of an operand: {@code A(1:3)} and {@code A(I)} both yield {@code A}.
     */
    public static String baseName(String operand) {
        String s = stripTerminator(operand);
        int paren = s.indexOf('(');
        return (paren > 0 ? s.substring(0, paren) : s).toUpperCase(Locale.ROOT);
    }

    public static boolean isReferenceModified(String operand) {
        int paren = operand.indexOf('(');
        return paren > 0 && operand.indexOf(':', paren) > 0;
    }

    /**
     * Drop a trailing sentence period or comma from a token.
     */
    public static String stripTerminator(String token) {
        String t = token;
        while (!t.isEmpty() && (t.endsWith(".") || t.endsWith(","))
                && !hasOpenLiteral(t.substring(0, t.length() - 1))) {
            t = t.substring(0, t.length() - 1);
        }
        return t;
    }
}
