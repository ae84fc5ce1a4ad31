package com.afsun.sqlanalyzer.core.ast;

public enum JoinType {
    INNER,
    LEFT,
    RIGHT,
    FULL
}
