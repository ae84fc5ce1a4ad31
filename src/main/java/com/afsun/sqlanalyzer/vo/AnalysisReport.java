package com.afsun.sqlanalyzer.vo;

import com.afsun.sqlanalyzer.core.parser.ParseError;
import com.afsun.sqlanalyzer.core.parser.ParseMetrics;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL脚本分析报告
 *
 * @author afsun
 */
@Data
public class AnalysisReport {

    private String traceId;

    /**
     * 成功解析并分析的语句，按脚本顺序
     */
    private List<StatementAnalysis> statements = new ArrayList<>();

    /**
     * 解析诊断，非空表示部分语句被跳过
     */
    private List<ParseError> errors = new ArrayList<>();

    private ParseMetrics metrics;

    /**
     * 解析+分析总耗时（毫秒）
     */
    private long analyzeMillis;
}
