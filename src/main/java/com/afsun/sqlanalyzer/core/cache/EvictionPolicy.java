package com.afsun.sqlanalyzer.core.cache;

/**
 * 缓存淘汰策略
 * 实现无需线程安全，由 {@link SingleFlightCache} 负责加锁
 *
 * @author afsun
 */
public interface EvictionPolicy<K> {

    /**
     * 新条目写入完成
     */
    void recordInsert(K key);

    /**
     * 已有条目被读取；key 不存在时忽略
     */
    void recordAccess(K key);

    void recordRemoval(K key);

    /**
     * 选出并移除一个淘汰对象，没有条目时返回 null
     */
    K evict();

    int size();
}
