package com.mainframe.analyzer.model;

public enum DivisionName {
    IDENTIFICATION,
    ENVIRONMENT,
    DATA,
    PROCEDURE;

    public static DivisionName fromCobol(String keyword) {
        if (keyword == null) {
            return null;
        }
        return switch (keyword.toUpperCase().trim()) {
            case "IDENTIFICATION", "ID" -> IDENTIFICATION;
            case "ENVIRONMENT" -> ENVIRONMENT;
            case "DATA" -> DATA;
            case "PROCEDURE" -> PROCEDURE;
            default -> null;
        };
    }
}
