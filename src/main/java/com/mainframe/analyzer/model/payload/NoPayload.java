package com.mainframe.analyzer.model.payload;

/**
 * Payload for statements that carry nothing beyond their kind and data references.
 */
public final class NoPayload implements StatementPayload {

    public static final NoPayload INSTANCE = new NoPayload();

    private NoPayload() {
    }

    @Override
    public String toString() {
        return "NoPayload";
    }
}
