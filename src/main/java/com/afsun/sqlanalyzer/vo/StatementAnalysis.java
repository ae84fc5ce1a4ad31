package com.afsun.sqlanalyzer.vo;

import com.afsun.sqlanalyzer.core.analyzer.AnalysisResult;
import lombok.Data;

/**
 * 单条语句的规范化文本与分析结果
 */
@Data
public class StatementAnalysis {
    private final String sql;
    private final AnalysisResult result;
}
