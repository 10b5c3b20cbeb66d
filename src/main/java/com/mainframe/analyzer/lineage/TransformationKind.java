package com.mainframe.analyzer.lineage;

public enum TransformationKind {
    MOVE,
    COMPUTE,
    STRING,
    UNSTRING,
    INSPECT,
    REF_MOD
}
