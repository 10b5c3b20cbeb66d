package com.mainframe.analyzer.impact;

import java.util.Locale;

public enum EntityKind {
    PROGRAM,
    COPYBOOK,
    FIELD,
    FILE,
    PARAGRAPH,
    TABLE,
    EXTERNAL;

    public static EntityKind fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
