package com.mainframe.analyzer.lineage;

import com.mainframe.analyzer.model.StatementKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FileOperation {

    @NonNull
    String fileName;

    @NonNull
    StatementKind operation;

    @NonNull
    Location location;

    /**
     * Record written or read, when the statement names one.
     */
    String recordType;

    @Singular
    List<String> keyFields;

    /**
     * OPEN mode (INPUT, OUTPUT, I-O, EXTEND); null for other operations.
     */
    String openMode;
}
