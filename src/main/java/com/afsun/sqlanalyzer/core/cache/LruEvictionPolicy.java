package com.afsun.sqlanalyzer.core.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;

/**
 * 最近最少使用淘汰策略
 *
 * @author afsun
 */
public class LruEvictionPolicy<K> implements EvictionPolicy<K> {

    private final LinkedHashMap<K, Boolean> order = new LinkedHashMap<>(16, 0.75f, true);

    @Override
    public void recordInsert(K key) {
        order.put(key, Boolean.TRUE);
    }

    @Override
    public void recordAccess(K key) {
        // access-order 模式下 get 会把 key 移到队尾
        order.get(key);
    }

    @Override
    public void recordRemoval(K key) {
        order.remove(key);
    }

    @Override
    public K evict() {
        Iterator<K> it = order.keySet().iterator();
        if (!it.hasNext()) {
            return null;
        }
        K eldest = it.next();
        it.remove();
        return eldest;
    }

    @Override
    public int size() {
        return order.size();
    }
}
