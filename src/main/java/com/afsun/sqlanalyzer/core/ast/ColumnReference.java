package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * 列引用：col 或 t.col，仅当解析到限定点号时 table 非空
 *
 * @author afsun
 */
@Data
public class ColumnReference implements Expression, Reusable {

    private String table;
    private String column;

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public void reset() {
        table = null;
        column = null;
    }
}
