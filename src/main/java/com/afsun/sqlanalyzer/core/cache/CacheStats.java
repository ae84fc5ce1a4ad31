package com.afsun.sqlanalyzer.core.cache;

import lombok.Data;

@Data
public class CacheStats {
    private final long hits;
    private final long misses;
    /**
     * 实际执行的计算次数
     */
    private final long computations;
    private final long evictions;
    private final int size;
    private final int maxSize;
}
