package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.UsageType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A data entry as written, before hierarchy resolution and type inference.
 */
@Value
@Builder(toBuilder = true)
public class RawDataEntry {

    int level;

    @NonNull
    String name;

    boolean filler;

    String picture;

    @NonNull
    @Builder.Default
    UsageType usage = UsageType.DISPLAY;

    /**
     * VALUE literals; a THRU range is kept as one entry "a THRU b".
     */
    @Singular("value")
    List<String> values;

    Integer occurs;

    Integer occursMin;

    String occursDependingOn;

    String redefines;

    String renames;

    @NonNull
    DataSection section;

    int lineNumber;

    String copybook;
}
