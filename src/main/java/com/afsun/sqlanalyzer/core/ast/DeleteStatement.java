package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * DELETE 语句，目前仅保留类型占位，解析器会报告"未实现"
 *
 * @author afsun
 */
@Data
public class DeleteStatement implements Statement {

    private TableReference table;

    @Override
    public StatementType getStatementType() {
        return StatementType.DELETE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDelete(this);
    }
}
