package com.afsun.sqlanalyzer.core.ast;

/**
 * 语法树节点标记接口
 *
 * @author afsun
 */
public interface Node {
}
