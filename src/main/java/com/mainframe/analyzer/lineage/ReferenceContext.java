package com.mainframe.analyzer.lineage;

/**
 * How a reference site uses the entity.
 */
public enum ReferenceContext {
    READ,
    WRITE,
    CONDITION,
    COMPUTE,
    PERFORM,
    CALL
}
