package com.mainframe.analyzer.impact;

public enum ImpactStatus {
    OK,
    NOT_FOUND
}
