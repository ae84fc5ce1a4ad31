package com.afsun.sqlanalyzer.core.parser;

/**
 * 解析诊断分类
 *
 * @author afsun
 */
public enum ParseErrorKind {
    /**
     * 预读词法单元与语法要求不符
     */
    SYNTAX,
    /**
     * 当前词法单元无法作为表达式开头
     */
    NO_PREFIX,
    /**
     * 当前词法单元在上下文中非法
     */
    UNEXPECTED_TOKEN,
    /**
     * 语句类型不支持或尚未实现
     */
    UNSUPPORTED_STATEMENT,
    /**
     * 调用方取消
     */
    CANCELLED
}
