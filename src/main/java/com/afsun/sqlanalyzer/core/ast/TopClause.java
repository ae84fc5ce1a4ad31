package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * SQL Server 特有的 TOP n [PERCENT]
 */
@Data
public class TopClause implements Node {
    private final int count;
    private final boolean percent;
}
