package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * JOIN 子句，对象池复用
 *
 * @author afsun
 */
@Data
public class JoinClause implements Node, Reusable {

    private JoinType joinType = JoinType.INNER;
    private TableReference table;
    private Expression condition;

    @Override
    public void reset() {
        joinType = JoinType.INNER;
        table = null;
        condition = null;
    }
}
