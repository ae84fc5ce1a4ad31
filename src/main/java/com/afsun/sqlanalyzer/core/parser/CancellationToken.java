package com.afsun.sqlanalyzer.core.parser;

import java.time.Duration;

/**
 * 协作式取消信号
 * 解析器只在推进词法单元前轮询，不会打断正在进行的产生式
 *
 * @author afsun
 */
public class CancellationToken {

    /**
     * 永不取消
     */
    public static final CancellationToken NONE = new CancellationToken(0L, false);

    private final long deadlineNanos;
    private final boolean cancellable;
    private volatile boolean cancelled;

    CancellationToken(long deadlineNanos, boolean cancellable) {
        this.deadlineNanos = deadlineNanos;
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(0L, true);
    }

    /**
     * 超过截止时间后视为已取消
     */
    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos(), true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE 不可取消");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadlineNanos != 0L && System.nanoTime() - deadlineNanos >= 0) {
            cancelled = true;
        }
        return cancelled;
    }
}
