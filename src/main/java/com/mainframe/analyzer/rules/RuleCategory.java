package com.mainframe.analyzer.rules;

import java.util.List;
import java.util.Locale;

/**
 * Business area a rule belongs to, inferred from lexical cues in the statement text.
 */
public enum RuleCategory {
    REGULATORY("regulat", "compliance", "audit"),
    FINANCIAL("amount", "total", "balance", "rate", "interest", "price", "cost", "tax", "fee"),
    QUALITY("valid", "check", "error", "invalid"),
    OPERATIONAL("date", "time", "status", "flag"),
    TECHNICAL;

    private final List<String> cues;

    RuleCategory(String... cues) {
        this.cues = List.of(cues);
    }

    /**
     * First category, in declaration order, with a cue contained in the text.
     */
    public static RuleCategory infer(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (RuleCategory category : values()) {
            for (String cue : category.cues) {
                if (lower.contains(cue)) {
                    return category;
                }
            }
        }
        return TECHNICAL;
    }
}
