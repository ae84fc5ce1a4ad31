package com.afsun.sqlanalyzer.core.exceptions;

import com.afsun.sqlanalyzer.core.parser.ParseError;
import com.afsun.sqlanalyzer.core.parser.ParseErrorKind;
import lombok.Getter;

/**
 * 语法产生式中止信号，携带对应诊断
 * 由解析器在语句级捕获并记录，不会逃逸出解析器公开方法
 *
 * @author afsun
 */
@Getter
public class SqlParseException extends SqlAnalyzerException {

    private final ParseError error;

    /**
     * 诊断是否已由 expectPeek 写入错误列表
     */
    private final boolean reported;

    public SqlParseException(ParseError error) {
        this(error, false);
    }

    private SqlParseException(ParseError error, boolean reported) {
        super("PARSE_" + error.getKind().name(), error.getMessage(), null);
        this.error = error;
        this.reported = reported;
    }

    public static SqlParseException alreadyReported(ParseError error) {
        return new SqlParseException(error, true);
    }

    public boolean isCancellation() {
        return error.getKind() == ParseErrorKind.CANCELLED;
    }
}
