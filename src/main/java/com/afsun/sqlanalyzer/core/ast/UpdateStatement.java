package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * UPDATE 语句，目前仅保留类型占位，解析器会报告"未实现"
 *
 * @author afsun
 */
@Data
public class UpdateStatement implements Statement {

    private TableReference table;

    @Override
    public StatementType getStatementType() {
        return StatementType.UPDATE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUpdate(this);
    }
}
