package com.afsun.sqlanalyzer.core.cache;

import com.afsun.sqlanalyzer.core.exceptions.SqlAnalyzerException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 单飞缓存：同一个 key 同时只有一次计算，并发调用方等待同一个计算结果
 * <p>
 * 条目写入后不再修改；计算失败不缓存，异常原样抛给所有等待方。
 * 容量超限时按 {@link EvictionPolicy} 淘汰已完成的条目。
 *
 * @author afsun
 */
@Slf4j
public class SingleFlightCache<K, V> {

    private final Map<K, FutureTask<V>> entries = new ConcurrentHashMap<>();

    /**
     * 访问顺序信息，所有读写都在 policy 自身的锁内
     */
    private final EvictionPolicy<K> policy;
    private final int maxSize;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SingleFlightCache(int maxSize) {
        this(maxSize, new LruEvictionPolicy<>());
    }

    public SingleFlightCache(int maxSize, EvictionPolicy<K> policy) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize 必须大于0: " + maxSize);
        }
        this.maxSize = maxSize;
        this.policy = policy;
    }

    public V get(K key, Supplier<V> loader) {
        FutureTask<V> task = entries.get(key);
        boolean owner = false;
        if (task == null) {
            FutureTask<V> created = new FutureTask<>(() -> {
                computations.incrementAndGet();
                return loader.get();
            });
            task = entries.putIfAbsent(key, created);
            if (task == null) {
                task = created;
                owner = true;
                misses.incrementAndGet();
                created.run();
            }
        }
        if (!owner) {
            hits.incrementAndGet();
        }

        V value = await(key, task);
        if (owner) {
            onInserted(key, task);
        } else {
            synchronized (policy) {
                policy.recordAccess(key);
            }
        }
        return value;
    }

    public V getIfPresent(K key) {
        FutureTask<V> task = entries.get(key);
        if (task == null || !task.isDone()) {
            return null;
        }
        return await(key, task);
    }

    public void invalidateAll() {
        synchronized (policy) {
            for (K key : entries.keySet()) {
                policy.recordRemoval(key);
            }
            entries.clear();
        }
    }

    public int size() {
        return entries.size();
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), computations.get(), evictions.get(),
                entries.size(), maxSize);
    }

    private V await(K key, FutureTask<V> task) {
        try {
            return task.get();
        } catch (ExecutionException e) {
            entries.remove(key, task);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SqlAnalyzerException("缓存计算失败: " + key, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SqlAnalyzerException("等待缓存计算时线程被中断: " + key, e);
        }
    }

    private void onInserted(K key, FutureTask<V> task) {
        synchronized (policy) {
            // 计算期间被 invalidateAll 清掉的条目不再登记
            if (entries.get(key) != task) {
                return;
            }
            policy.recordInsert(key);
            while (policy.size() > maxSize) {
                K victim = policy.evict();
                if (victim == null) {
                    break;
                }
                entries.remove(victim);
                evictions.incrementAndGet();
                log.debug("缓存容量超限，淘汰条目: {}", victim);
            }
        }
    }
}
