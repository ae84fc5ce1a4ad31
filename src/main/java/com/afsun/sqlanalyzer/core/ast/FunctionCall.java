package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = new ArrayList<>(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
