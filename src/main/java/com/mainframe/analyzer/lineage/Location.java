package com.mainframe.analyzer.lineage;

import lombok.NonNull;
import lombok.Value;

@Value
public class Location {
    @NonNull
    String program;
    String paragraph;
    int lineNumber;
}
