package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class Section {

    @NonNull
    String name;

    @NonNull
    DivisionName division;

    int lineNumber;

    @Singular("paragraph")
    List<String> paragraphs;
}
