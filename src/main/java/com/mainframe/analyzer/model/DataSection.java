package com.mainframe.analyzer.model;

/**
 * DATA DIVISION section an item was declared in.
 */
public enum DataSection {
    FILE("FILE"),
    WORKING_STORAGE("WORKING-STORAGE"),
    LOCAL_STORAGE("LOCAL-STORAGE"),
    LINKAGE("LINKAGE");

    private final String cobolName;

    DataSection(String cobolName) {
        this.cobolName = cobolName;
    }

    public String getCobolName() {
        return cobolName;
    }

    /**
     * Resolve a section header name (e.g. "WORKING-STORAGE") to a section, or null if it is
     * not a data section.
     */
    public static DataSection fromCobol(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toUpperCase().trim();
        for (DataSection section : values()) {
            if (section.cobolName.equals(normalized)) {
                return section;
            }
        }
        return null;
    }
}
