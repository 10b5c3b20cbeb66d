package com.mainframe.analyzer.rules;

public enum RuleKind {
    VALIDATION,
    CALCULATION,
    DECISION,
    CONSTRAINT,
    TRANSFORMATION,
    AUDIT
}
