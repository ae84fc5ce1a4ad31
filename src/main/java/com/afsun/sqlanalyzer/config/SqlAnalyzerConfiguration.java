package com.afsun.sqlanalyzer.config;

import com.afsun.sqlanalyzer.core.analyzer.AnalysisResult;
import com.afsun.sqlanalyzer.core.analyzer.CachingQueryAnalyzer;
import com.afsun.sqlanalyzer.core.analyzer.DefaultQueryAnalyzer;
import com.afsun.sqlanalyzer.core.cache.LruEvictionPolicy;
import com.afsun.sqlanalyzer.core.cache.SingleFlightCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 分析器组件装配
 *
 * @author afsun
 */
@Configuration
@Slf4j
public class SqlAnalyzerConfiguration {

    @Bean
    public CachingQueryAnalyzer queryAnalyzer(SqlAnalyzerProperties properties) {
        int maxSize = properties.getCache().getMaxSize();
        log.info("初始化查询分析器, 缓存上限={}, 复杂JOIN阈值={}", maxSize, properties.getComplexJoinThreshold());
        SingleFlightCache<String, AnalysisResult> cache = new SingleFlightCache<>(maxSize, new LruEvictionPolicy<>());
        return new CachingQueryAnalyzer(new DefaultQueryAnalyzer(properties.getComplexJoinThreshold()), cache);
    }
}
