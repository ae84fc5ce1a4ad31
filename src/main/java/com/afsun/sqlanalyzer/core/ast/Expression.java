package com.afsun.sqlanalyzer.core.ast;

/**
 * 表达式节点
 *
 * @author afsun
 */
public interface Expression extends Node {

    <R> R accept(ExpressionVisitor<R> visitor);
}
