package com.mainframe.analyzer.model.payload;

public enum LogicalOperator {
    AND,
    OR,
    NOT
}
