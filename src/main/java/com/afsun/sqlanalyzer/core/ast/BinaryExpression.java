package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * 二元表达式：a = b、a AND b、a LIKE 'x%' 等，operator 统一为大写
 *
 * @author afsun
 */
@Data
public class BinaryExpression implements Expression, Reusable {

    private Expression left;
    private String operator;
    private Expression right;

    public boolean isLogical() {
        return "AND".equals(operator) || "OR".equals(operator);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }

    @Override
    public void reset() {
        left = null;
        operator = null;
        right = null;
    }
}
