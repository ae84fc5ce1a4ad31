package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * * 或 t.*
 *
 * @author afsun
 */
@Data
public class StarExpression implements Expression {

    private final String table;

    public StarExpression() {
        this(null);
    }

    public StarExpression(String table) {
        this.table = table;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStarExpression(this);
    }
}
