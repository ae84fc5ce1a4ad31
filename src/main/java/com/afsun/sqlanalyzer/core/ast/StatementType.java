package com.afsun.sqlanalyzer.core.ast;

public enum StatementType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE
}
