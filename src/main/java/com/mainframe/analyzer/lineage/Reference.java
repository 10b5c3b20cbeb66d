package com.mainframe.analyzer.lineage;

import lombok.NonNull;
import lombok.Value;

/**
 * One reference site of a field, paragraph, copybook or file.
 */
@Value
public class Reference {
    @NonNull
    String program;
    /**
     * Paragraph name, or "DIVISION/SECTION" for COPY directives outside the PROCEDURE DIVISION.
     */
    String location;
    int lineNumber;
    @NonNull
    ReferenceContext context;
}
