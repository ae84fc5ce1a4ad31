package com.afsun.sqlanalyzer.core.exceptions;

/**
 * 解析截止时间已到，且没有任何语句完成解析
 *
 * @author afsun
 */
public class AnalysisTimeoutException extends SqlAnalyzerException {

    public AnalysisTimeoutException(long timeoutMillis) {
        super("PARSE_TIMEOUT", "SQL解析超时: " + timeoutMillis + "ms",
                "拆分脚本或调大 sql.analyzer.parse-timeout-ms");
    }
}
