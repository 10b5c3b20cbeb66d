package com.mainframe.analyzer.model;

public enum AccessMode {
    SEQUENTIAL,
    RANDOM,
    DYNAMIC;

    public static AccessMode fromCobol(String value) {
        if (value == null) {
            return SEQUENTIAL;
        }
        return switch (value.toUpperCase().trim()) {
            case "RANDOM" -> RANDOM;
            case "DYNAMIC" -> DYNAMIC;
            default -> SEQUENTIAL;
        };
    }
}
