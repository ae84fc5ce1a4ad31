package com.afsun.sqlanalyzer.core.ast;

/**
 * 表达式访问者，新增表达式类型时所有实现必须同步补充
 *
 * @author afsun
 */
public interface ExpressionVisitor<R> {

    R visitColumnReference(ColumnReference expr);

    R visitLiteral(Literal expr);

    R visitBinaryExpression(BinaryExpression expr);

    R visitStarExpression(StarExpression expr);

    R visitFunctionCall(FunctionCall expr);
}
