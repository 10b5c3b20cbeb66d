package com.mainframe.analyzer.rules;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Action {
    @NonNull
    ActionType type;
    String target;
    String value;
    @Singular
    List<String> parameters;
}
