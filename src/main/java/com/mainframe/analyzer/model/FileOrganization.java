package com.mainframe.analyzer.model;

public enum FileOrganization {
    SEQUENTIAL,
    LINE_SEQUENTIAL,
    INDEXED,
    RELATIVE;

    /**
     * Resolve an ORGANIZATION clause value; unknown or absent values mean SEQUENTIAL.
     */
    public static FileOrganization fromCobol(String value) {
        if (value == null) {
            return SEQUENTIAL;
        }
        return switch (value.toUpperCase().trim()) {
            case "INDEXED" -> INDEXED;
            case "RELATIVE" -> RELATIVE;
            case "LINE-SEQUENTIAL", "LINE SEQUENTIAL" -> LINE_SEQUENTIAL;
            default -> SEQUENTIAL;
        };
    }
}
