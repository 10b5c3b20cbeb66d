package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One of the four COBOL divisions as found in the source.
 */
@Value
@Builder(toBuilder = true)
public class Division {

    @NonNull
    DivisionName name;

    int lineNumber;

    @Singular("section")
    List<String> sections;

    /**
     * IDENTIFICATION paragraphs such as AUTHOR or DATE-WRITTEN, keyed by paragraph name.
     */
    @Singular("metadataEntry")
    Map<String, String> metadata;
}
