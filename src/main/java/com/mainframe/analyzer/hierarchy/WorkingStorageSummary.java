package com.mainframe.analyzer.hierarchy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * WORKING-STORAGE at a glance: how many items, which carry initial values, which act as flags.
 */
@Value
@Builder
public class WorkingStorageSummary {

    int itemCount;

    @Singular
    List<Constant> constants;

    @Singular
    List<Flag> flags;

    @Value
    public static class Constant {
        String name;
        String value;
        String type;
    }

    @Value
    @Builder
    public static class Flag {
        String name;

        /**
         * Owning field for a level 88 condition name, null otherwise.
         */
        String field;

        @Singular
        List<String> values;

        /**
         * Guessed from the name; null when nothing matches.
         */
        String purpose;
    }
}
