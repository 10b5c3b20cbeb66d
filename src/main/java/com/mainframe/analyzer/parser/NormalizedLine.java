package com.mainframe.analyzer.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * One logical source line: program text only, upper-cased outside literals.
 */
@Value
public class NormalizedLine {

    /**
     * 1-based physical line the logical line starts on.
     */
    int lineNumber;

    @NonNull
    String text;

    /**
     * True when one or more continuation lines were joined onto this line.
     */
    boolean continued;
}
