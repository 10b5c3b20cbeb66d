package com.mainframe.analyzer.lineage;

import lombok.NonNull;
import lombok.Value;

/**
 * Lineage output for one program.
 */
@Value
public class ProgramLineage {
    @NonNull
    DataLineage lineage;
    @NonNull
    WhereUsedIndex whereUsed;
    @NonNull
    FileIoMap fileIo;
}
