package com.mainframe.analyzer.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of a DATA DIVISION entry.
 */
@Data
@AllArgsConstructor
public class DataEntryToken {
    private TokenType type;
    private String value;
    private int line;

    public enum TokenType {
        LEVEL_NUMBER,
        PIC,
        PICTURE_STRING,
        OCCURS,
        TO,
        TIMES,
        REDEFINES,
        RENAMES,
        VALUE,
        USAGE,
        USAGE_TYPE,
        DEPENDING,
        ON,
        THRU,
        IS,
        FILLER,
        INDEXED,
        KEY,
        BY,
        PERIOD,
        STRING_LITERAL,
        NUMERIC_LITERAL,
        IDENTIFIER,
        LPAREN,
        RPAREN,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isLiteral() {
        return type == TokenType.STRING_LITERAL || type == TokenType.NUMERIC_LITERAL
                || type == TokenType.LEVEL_NUMBER;
    }
}
