package com.mainframe.analyzer.lineage;

import lombok.NonNull;
import lombok.Value;

/**
 * Where a field's value leaves the program.
 */
@Value
public class DataSink {

    public enum Kind {
        FILE_OUTPUT,
        DISPLAY,
        CALL_PARAMETER,
        LINKAGE
    }

    @NonNull
    Kind kind;

    @NonNull
    String field;

    /**
     * File name or called program, null for DISPLAY and LINKAGE.
     */
    String destination;

    Location location;
}
