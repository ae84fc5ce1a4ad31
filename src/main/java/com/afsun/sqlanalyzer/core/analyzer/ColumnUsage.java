package com.afsun.sqlanalyzer.core.analyzer;

/**
 * 列引用出现的子句
 *
 * @author afsun
 */
public enum ColumnUsage {
    SELECT,
    WHERE,
    JOIN,
    GROUP_BY,
    HAVING,
    ORDER_BY
}
