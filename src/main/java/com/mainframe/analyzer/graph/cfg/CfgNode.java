package com.mainframe.analyzer.graph.cfg;

import lombok.NonNull;
import lombok.Value;

/**
 * One paragraph of the program.
 */
@Value
public class CfgNode {
    @NonNull
    String id;
    String section;
    int lineNumber;
    int statementCount;
}
