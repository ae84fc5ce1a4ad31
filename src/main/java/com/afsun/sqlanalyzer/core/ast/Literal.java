package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * 字面量，值类型为 Long、Double 或 String
 *
 * @author afsun
 */
@Data
public class Literal implements Expression {

    private final Object value;

    public static Literal ofInteger(long value) {
        return new Literal(value);
    }

    public static Literal ofFloat(double value) {
        return new Literal(value);
    }

    public static Literal ofString(String value) {
        return new Literal(value);
    }

    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
