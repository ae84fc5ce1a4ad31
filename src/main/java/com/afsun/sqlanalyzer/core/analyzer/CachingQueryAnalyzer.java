package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.cache.CacheStats;
import com.afsun.sqlanalyzer.core.cache.SingleFlightCache;
import lombok.extern.slf4j.Slf4j;

/**
 * 带指纹缓存的分析器装饰器
 * 同一指纹并发请求时只计算一次，所有调用方拿到同一个结果实例
 *
 * @author afsun
 */
@Slf4j
public class CachingQueryAnalyzer implements QueryAnalyzer {

    private final QueryAnalyzer delegate;
    private final SingleFlightCache<String, AnalysisResult> cache;

    public CachingQueryAnalyzer(QueryAnalyzer delegate, SingleFlightCache<String, AnalysisResult> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public AnalysisResult analyze(Statement statement) {
        if (statement == null) {
            throw new IllegalArgumentException("statement 不能为空");
        }
        String fingerprint = QueryFingerprint.of(statement);
        return cache.get(fingerprint, () -> {
            log.debug("分析缓存未命中, fingerprint={}", fingerprint);
            return delegate.analyze(statement);
        });
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.invalidateAll();
    }
}
