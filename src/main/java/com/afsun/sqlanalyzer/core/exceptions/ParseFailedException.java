package com.afsun.sqlanalyzer.core.exceptions;

import com.afsun.sqlanalyzer.core.parser.ParseError;
import lombok.Getter;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

import java.util.Collections;
import java.util.List;

/**
 * SQL脚本中没有可分析的语句
 *
 * @author afsun
 */
@Getter
public class ParseFailedException extends SqlAnalyzerException {

    private final transient List<ParseError> errors;

    public ParseFailedException(List<ParseError> errors, String message, Object... args) {
        super("PARSE_FAILED", MessageFormatter.arrayFormat(message, ArrayUtils.nullToEmpty(args)).getMessage(),
                "请根据诊断信息中的行列号修正SQL", firstMessage(errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    private static String firstMessage(List<ParseError> errors) {
        return errors.isEmpty() ? null : errors.get(0).getMessage();
    }
}
