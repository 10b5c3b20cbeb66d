package com.mainframe.analyzer.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of procedure statement kinds recognized by the classifier.
 */
public enum StatementKind {
    MOVE("MOVE"),
    COMPUTE("COMPUTE"),
    ADD("ADD"),
    SUBTRACT("SUBTRACT"),
    MULTIPLY("MULTIPLY"),
    DIVIDE("DIVIDE"),
    IF("IF"),
    ELSE("ELSE"),
    END_IF("END-IF"),
    EVALUATE("EVALUATE"),
    WHEN("WHEN"),
    END_EVALUATE("END-EVALUATE"),
    PERFORM("PERFORM"),
    END_PERFORM("END-PERFORM"),
    GO_TO("GO"),
    CALL("CALL"),
    READ("READ"),
    WRITE("WRITE"),
    REWRITE("REWRITE"),
    DELETE("DELETE"),
    START("START"),
    OPEN("OPEN"),
    CLOSE("CLOSE"),
    DISPLAY("DISPLAY"),
    ACCEPT("ACCEPT"),
    STRING("STRING"),
    UNSTRING("UNSTRING"),
    INSPECT("INSPECT"),
    INITIALIZE("INITIALIZE"),
    SET("SET"),
    SEARCH("SEARCH"),
    EXIT("EXIT"),
    GOBACK("GOBACK"),
    STOP_RUN("STOP"),
    CONTINUE("CONTINUE"),
    COPY("COPY"),
    EXEC("EXEC"),
    OTHER("");

    private static final Map<String, StatementKind> BY_VERB;

    static {
        Map<String, StatementKind> byVerb = new HashMap<>();
        for (StatementKind kind : values()) {
            if (!kind.verb.isEmpty()) {
                byVerb.put(kind.verb, kind);
            }
        }
        byVerb.put("GOTO", GO_TO);
        BY_VERB = Map.copyOf(byVerb);
    }

    private final String verb;

    StatementKind(String verb) {
        this.verb = verb;
    }

    public String getVerb() {
        return verb;
    }

    /**
     * Look up the kind introduced by a leading verb, or null when the word is not a verb.
     */
    public static StatementKind fromVerb(String word) {
        if (word == null) {
            return null;
        }
        return BY_VERB.get(word.toUpperCase());
    }

    public boolean isConditional() {
        return this == IF || this == EVALUATE || this == WHEN;
    }

    public boolean isArithmetic() {
        return this == COMPUTE || this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
    }

    public boolean isFileIo() {
        return this == READ || this == WRITE || this == REWRITE || this == DELETE
                || this == START || this == OPEN || this == CLOSE;
    }

    public boolean isTerminal() {
        return this == GOBACK || this == STOP_RUN;
    }
}
