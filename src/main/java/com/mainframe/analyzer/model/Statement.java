package com.mainframe.analyzer.model;

import com.mainframe.analyzer.model.payload.NoPayload;
import com.mainframe.analyzer.model.payload.StatementPayload;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single procedure statement with its classified payload.
 */
@Value
@Builder(toBuilder = true)
public class Statement {

    public static final double RECOGNIZED_CONFIDENCE = 1.0;
    public static final double UNRECOGNIZED_CONFIDENCE = 0.3;

    @NonNull
    StatementKind kind;

    int lineNumber;

    @NonNull
    String content;

    @NonNull
    @Builder.Default
    StatementPayload payload = NoPayload.INSTANCE;

    /**
     * Identifiers referenced by the statement, in order of appearance, without duplicates.
     */
    @Singular("dataReference")
    List<String> dataReferences;

    @Builder.Default
    double confidence = RECOGNIZED_CONFIDENCE;

    /**
     * Typed access to the payload; returns null when the payload is of another type.
     */
    public <T extends StatementPayload> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }
}
