package com.afsun.sqlanalyzer.core.analyzer;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
