package com.afsun.sqlanalyzer.core.ast;

/**
 * 语句访问者
 *
 * @author afsun
 */
public interface StatementVisitor<R> {

    R visitSelect(SelectStatement stmt);

    R visitInsert(InsertStatement stmt);

    R visitUpdate(UpdateStatement stmt);

    R visitDelete(DeleteStatement stmt);
}
