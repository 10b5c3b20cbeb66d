package com.mainframe.analyzer.rules;

import java.util.Locale;

public enum RuleImpact {
    HIGH,
    MEDIUM,
    LOW;

    public static RuleImpact assess(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("critical") || lower.contains("error") || lower.contains("total")) {
            return HIGH;
        }
        if (lower.contains("check") || lower.contains("valid")) {
            return MEDIUM;
        }
        return LOW;
    }
}
