package com.afsun.sqlanalyzer.core.ast;

/**
 * 可复用节点：归还对象池前清空全部状态
 *
 * @author afsun
 */
public interface Reusable {

    void reset();
}
