package com.afsun.sqlanalyzer.core.analyzer;

import lombok.Data;

@Data
public class ColumnInfo {
    /**
     * 限定符（表名或别名），未限定列为 null
     */
    private final String table;
    private final String name;
    private final ColumnUsage usage;
}
