package com.afsun.sqlanalyzer.core.parser;

import com.afsun.sqlanalyzer.core.ast.Statement;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 批量解析结果：成功解析的语句、全部诊断与指标
 *
 * @author afsun
 */
@Data
public class ParseResult {
    private final List<Statement> statements;
    private final List<ParseError> errors;
    private final ParseMetrics metrics;

    public ParseResult(List<Statement> statements, List<ParseError> errors, ParseMetrics metrics) {
        this.statements = Collections.unmodifiableList(statements);
        this.errors = Collections.unmodifiableList(errors);
        this.metrics = metrics;
    }

    /**
     * 至少解析出一条语句且没有任何诊断
     */
    public boolean isSuccess() {
        return errors.isEmpty() && !statements.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
