package com.mainframe.analyzer.graph.call;

public enum CallNodeType {
    MAIN,
    SUBPROGRAM,
    EXTERNAL
}
