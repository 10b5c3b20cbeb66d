package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * CALL target [USING ...] [GIVING|RETURNING ...].
 *
 * {@code dynamic} is true when the target is an identifier rather than a literal.
 */
@Value
@Builder
public class CallPayload implements StatementPayload {

    @NonNull
    String target;

    boolean dynamic;

    @Singular("argument")
    List<String> using;

    String giving;
}
