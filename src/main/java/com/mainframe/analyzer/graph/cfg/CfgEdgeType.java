package com.mainframe.analyzer.graph.cfg;

public enum CfgEdgeType {
    PERFORM,
    GOTO
}
