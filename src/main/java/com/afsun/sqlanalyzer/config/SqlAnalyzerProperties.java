package com.afsun.sqlanalyzer.config;

import com.afsun.sqlanalyzer.core.analyzer.DefaultQueryAnalyzer;
import com.afsun.sqlanalyzer.core.parser.NodePool;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * sql.analyzer.* 配置项
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "sql.analyzer")
public class SqlAnalyzerProperties {

    /**
     * JOIN 数超过该值时给出 COMPLEX_QUERY 建议
     */
    private int complexJoinThreshold = DefaultQueryAnalyzer.DEFAULT_COMPLEX_JOIN_THRESHOLD;

    /**
     * 单次解析截止时间（毫秒），0 表示不限制
     */
    private long parseTimeoutMs = 0;

    /**
     * SQL文本长度上限（字符），默认1M
     */
    private int maxTextLength = 1024 * 1024;

    private Cache cache = new Cache();

    private Pool pool = new Pool();

    @Data
    public static class Cache {
        /**
         * 分析结果缓存条目上限，超出后按 LRU 淘汰
         */
        private int maxSize = 1000;
    }

    @Data
    public static class Pool {
        /**
         * 每种节点类型的空闲对象上限
         */
        private int maxFreePerShape = NodePool.DEFAULT_MAX_FREE_PER_SHAPE;
    }
}
