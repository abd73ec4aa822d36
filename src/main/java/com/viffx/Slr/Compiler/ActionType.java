package com.viffx.Slr.Compiler;

public enum ActionType {
    SHIFT,
    REDUCE,
    GOTO,
    ACCEPT,
}
