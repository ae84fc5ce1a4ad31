package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

@Data
public class OrderByClause implements Node {
    private final Expression expression;
    private final SortDirection direction;
}
