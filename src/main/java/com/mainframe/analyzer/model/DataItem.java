package com.mainframe.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One DATA DIVISION declaration.
 *
 * Items of a program live in a single ordered table; {@code parentIndex} and
 * {@code childIndices} are positions in that table, never object references.
 */
@Value
@Builder(toBuilder = true)
public class DataItem {

    public static final int NO_PARENT = -1;

    int index;

    @NonNull
    String name;

    int level;

    String picture;

    @NonNull
    @Builder.Default
    UsageType usage = UsageType.DISPLAY;

    /**
     * First VALUE literal, if any.
     */
    String value;

    /**
     * All VALUE literals; for level 88 items these are the condition values.
     */
    @Singular("valueLiteral")
    List<String> values;

    Integer occurs;

    Integer occursMin;

    String occursDependingOn;

    String redefines;

    /**
     * Target of a level 66 RENAMES clause ("A" or "A THRU B").
     */
    String renames;

    @Builder.Default
    int parentIndex = NO_PARENT;

    @Singular("childIndex")
    List<Integer> childIndices;

    @NonNull
    DataSection section;

    @NonNull
    @Builder.Default
    DataType dataType = DataType.ALPHANUMERIC;

    int length;

    String editMask;

    boolean filler;

    int lineNumber;

    /**
     * Copybook the declaration came from, null when declared inline.
     */
    String copybook;

    @JsonIgnore
    public boolean isConditionName() {
        return level == 88;
    }

    @JsonIgnore
    public boolean isRenames() {
        return level == 66;
    }

    @JsonIgnore
    public boolean isStandalone() {
        return level == 77;
    }

    @JsonIgnore
    public boolean isGroup() {
        return picture == null && !childIndices.isEmpty();
    }

    @JsonIgnore
    public boolean hasParent() {
        return parentIndex != NO_PARENT;
    }
}
