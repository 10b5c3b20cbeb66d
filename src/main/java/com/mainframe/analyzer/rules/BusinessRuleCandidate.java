package com.mainframe.analyzer.rules;

import com.mainframe.analyzer.lineage.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A statement or declaration that probably encodes business logic.
 */
@Value
@Builder(toBuilder = true)
public class BusinessRuleCandidate {

    /**
     * {@code BR-<program>-<paragraph>-<line>}, with {@code -n} appended for the n-th rule on a line.
     */
    @NonNull
    String id;

    @NonNull
    RuleKind kind;

    @NonNull
    RuleCategory category;

    @NonNull
    String description;

    String naturalLanguage;

    @Singular
    List<Condition> conditions;

    @Singular
    List<Action> actions;

    @Singular("involvedField")
    List<String> dataInvolved;

    @NonNull
    Location location;

    double confidence;

    @NonNull
    RuleImpact impact;

    /**
     * Fields the rule's result depends on.
     */
    @Singular
    List<String> dependencies;
}
