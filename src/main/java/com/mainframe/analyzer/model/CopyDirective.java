package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A COPY statement. Copybooks are recorded as dependencies, never expanded in place.
 */
@Value
@Builder
public class CopyDirective {

    @NonNull
    String copybookName;

    /**
     * Library given with OF / IN, null when absent.
     */
    String library;

    int lineNumber;

    DivisionName division;

    /**
     * Section the directive appeared in (e.g. WORKING-STORAGE), null outside any section.
     */
    String section;
}
