package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A file declared by a FILE-CONTROL SELECT entry, joined with its FD/SD record layout.
 */
@Value
@Builder(toBuilder = true)
public class FileDefinition {

    @NonNull
    String name;

    /**
     * ASSIGN TO target (DD name or path literal).
     */
    String assignTo;

    @NonNull
    @Builder.Default
    FileOrganization organization = FileOrganization.SEQUENTIAL;

    @NonNull
    @Builder.Default
    AccessMode accessMode = AccessMode.SEQUENTIAL;

    String recordKey;

    @Singular("alternateKey")
    List<String> alternateKeys;

    String fileStatus;

    /**
     * True when the file was described with SD (sort file) rather than FD.
     */
    boolean sortFile;

    /**
     * Names of the 01 records under the file's FD.
     */
    @Singular("recordName")
    List<String> recordNames;

    /**
     * Data item table indices of the 01 records under the file's FD.
     */
    @Singular("recordItem")
    List<Integer> recordDescription;

    int lineNumber;
}
