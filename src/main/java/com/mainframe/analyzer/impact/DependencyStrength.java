package com.mainframe.analyzer.impact;

/**
 * STRONG edges are resolved at compile time (static calls, COPY, declarations); WEAK edges are
 * resolved at run time or inferred (dynamic calls, field usage).
 */
public enum DependencyStrength {
    STRONG,
    WEAK
}
