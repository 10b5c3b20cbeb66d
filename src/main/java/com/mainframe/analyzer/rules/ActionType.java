package com.mainframe.analyzer.rules;

public enum ActionType {
    SET,
    COMPUTE,
    DISPLAY,
    CALL,
    PERFORM,
    MOVE
}
