package com.mainframe.analyzer.lineage;

import lombok.NonNull;
import lombok.Value;

/**
 * Where a field's value enters the program.
 */
@Value
public class DataSource {

    public enum Kind {
        FILE_INPUT,
        LINKAGE,
        LITERAL,
        COMPUTED
    }

    @NonNull
    Kind kind;

    @NonNull
    String field;

    /**
     * File name, literal text or formula, depending on the kind.
     */
    String origin;

    Location location;
}
