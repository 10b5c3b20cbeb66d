package com.mainframe.analyzer.model.payload;

import com.mainframe.analyzer.model.StatementKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * READ, WRITE, REWRITE, DELETE, START, OPEN and CLOSE.
 *
 * WRITE and REWRITE name a record rather than a file: {@code fileNames} is empty for them and
 * {@code recordName} is mapped back to a file through the program's FD table.
 */
@Value
@Builder
public class FileIoPayload implements StatementPayload {

    @NonNull
    StatementKind operation;

    @Singular("fileName")
    List<String> fileNames;

    String recordName;

    String keyField;

    String intoField;

    String fromField;

    /**
     * INPUT, OUTPUT, I-O or EXTEND for each OPEN file, parallel to {@code fileNames}.
     */
    @Singular("openMode")
    List<String> openModes;
}
