package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * SELECT 语句
 * 由解析器从对象池取出并填充，返回给调用方后不再修改
 *
 * @author afsun
 */
@Data
public class SelectStatement implements Statement, Reusable {

    private boolean distinct;
    private TopClause top;
    private final List<Expression> columns = new ArrayList<>();
    private FromClause from;
    /**
     * 保持源码顺序，分析器据此推断左表
     */
    private final List<JoinClause> joins = new ArrayList<>();
    private Expression where;
    private final List<Expression> groupBy = new ArrayList<>();
    private Expression having;
    private final List<OrderByClause> orderBy = new ArrayList<>();

    @Override
    public StatementType getStatementType() {
        return StatementType.SELECT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public void reset() {
        distinct = false;
        top = null;
        columns.clear();
        from = null;
        joins.clear();
        where = null;
        groupBy.clear();
        having = null;
        orderBy.clear();
    }
}
