package com.afsun.sqlanalyzer.core.ast;

/**
 * 语句节点
 *
 * @author afsun
 */
public interface Statement extends Node {

    StatementType getStatementType();

    <R> R accept(StatementVisitor<R> visitor);
}
