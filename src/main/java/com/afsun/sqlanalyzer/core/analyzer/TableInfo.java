package com.afsun.sqlanalyzer.core.analyzer;

import lombok.Data;

@Data
public class TableInfo {
    private final String name;
    private final String schema;
    private final String alias;
    /**
     * 使用方式，取语句类型：SELECT / INSERT / UPDATE / DELETE
     */
    private final String usage;
}
