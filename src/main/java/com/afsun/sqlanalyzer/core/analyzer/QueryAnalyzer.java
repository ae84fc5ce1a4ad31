package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.Statement;

/**
 * 查询分析器
 *
 * @author afsun
 */
public interface QueryAnalyzer {
    /**
     * 分析一条已成功解析的语句，提取表、列、JOIN、复杂度与优化建议
     *
     * @param statement 语法树，不能是解析失败的残缺树
     * @return 分析结果
     * @throws IllegalArgumentException statement 为 null
     */
    AnalysisResult analyze(Statement statement);
}
