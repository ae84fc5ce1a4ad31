package com.afsun.sqlanalyzer.service;

import com.afsun.sqlanalyzer.core.cache.CacheStats;
import com.afsun.sqlanalyzer.vo.AnalysisReport;
import com.afsun.sqlanalyzer.vo.ParseSummary;

public interface SqlAnalysisService {

    /**
     * 仅解析，返回规范化语句与诊断
     */
    ParseSummary parse(String sqlText);

    /**
     * 解析并分析脚本中的每条语句
     *
     * @throws com.afsun.sqlanalyzer.core.exceptions.ParseFailedException 没有任何语句解析成功
     * @throws com.afsun.sqlanalyzer.core.exceptions.AnalysisTimeoutException 解析超时且没有语句完成
     */
    AnalysisReport analyze(String sqlText);

    CacheStats cacheStats();
}
