package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InspectPayload implements StatementPayload {

    public enum Mode {
        TALLYING,
        REPLACING,
        CONVERTING
    }

    String target;

    Mode mode;

    /**
     * Counter field of a TALLYING clause.
     */
    String tallyingField;
}
