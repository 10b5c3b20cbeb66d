package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.Value;

/**
 * PERFORM paragraph [THRU paragraph] [n TIMES | UNTIL cond | VARYING ...], or an inline PERFORM.
 */
@Value
@Builder
public class PerformPayload implements StatementPayload {

    /**
     * Performed paragraph or section, null for an inline PERFORM.
     */
    String target;

    String thruTarget;

    String until;

    String times;

    String varying;

    boolean inline;
}
