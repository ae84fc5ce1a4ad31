package com.afsun.sqlanalyzer.core.parser;

import lombok.Getter;

/**
 * 解析上下文：持有对象池等可跨多次解析复用的状态
 * 同一时刻只能被一个线程使用
 *
 * @author afsun
 */
@Getter
public class ParseContext {

    private final NodePool nodePool;

    public ParseContext() {
        this(NodePool.DEFAULT_MAX_FREE_PER_SHAPE);
    }

    public ParseContext(int maxFreePerShape) {
        this.nodePool = new NodePool(maxFreePerShape);
    }
}
