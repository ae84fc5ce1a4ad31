package com.afsun.sqlanalyzer.core.ast;

public enum SortDirection {
    ASC,
    DESC
}
