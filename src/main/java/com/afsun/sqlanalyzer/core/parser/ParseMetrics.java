package com.afsun.sqlanalyzer.core.parser;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 解析性能指标，仅用于观测
 *
 * @author afsun
 */
@Data
public class ParseMetrics {
    private final long parseDurationMillis;
    private final int tokensProcessed;
    private final double tokensPerSecond;
    private final int errorCount;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("parse_duration_ms", parseDurationMillis);
        map.put("tokens_processed", tokensProcessed);
        map.put("tokens_per_second", tokensPerSecond);
        map.put("error_count", errorCount);
        return map;
    }
}
