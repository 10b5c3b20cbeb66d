package com.mainframe.analyzer.impact;

import lombok.NonNull;
import lombok.Value;

/**
 * Neighbour counts without a full traversal.
 */
@Value
public class InstantImpact {
    @NonNull
    EntityRef source;
    boolean found;
    int directCount;
    int indirectCount;
    Severity riskLevel;
    String summary;

    static Severity riskOf(int direct, int indirect) {
        int total = direct + indirect;
        if (total > 20 || direct > 10) {
            return Severity.CRITICAL;
        }
        if (total > 10 || direct > 5) {
            return Severity.HIGH;
        }
        if (total > 3 || direct > 2) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
