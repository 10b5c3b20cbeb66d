package com.mainframe.analyzer.model.payload;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * EXEC SQL / EXEC CICS block, recorded without interpretation beyond table and host variables.
 */
@Value
@Builder
public class ExecPayload implements StatementPayload {

    @NonNull
    String language;

    String body;

    @Singular("table")
    List<String> tables;

    @Singular("hostVariable")
    List<String> hostVariables;
}
