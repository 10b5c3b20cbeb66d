package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * MOVE source TO target... ; literal sources are kept apart from field sources.
 */
@Value
@Builder
public class MovePayload implements StatementPayload {

    @Singular("source")
    List<String> sources;

    @Singular("literal")
    List<String> literals;

    @Singular("target")
    List<String> targets;

    /**
     * A source or target used reference modification, e.g. {@code WS-DATE(1:4)}.
     */
    boolean referenceModified;

    boolean corresponding;
}
