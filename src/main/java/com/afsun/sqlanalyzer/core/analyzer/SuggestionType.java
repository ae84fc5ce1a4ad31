package com.afsun.sqlanalyzer.core.analyzer;

/**
 * 优化建议类型
 *
 * @author afsun
 */
public enum SuggestionType {
    /**
     * JOIN 数量超过阈值
     */
    COMPLEX_QUERY,
    SELECT_STAR,
    /**
     * 多表查询没有 WHERE 条件
     */
    MISSING_WHERE,
    /**
     * LIKE '%xxx' 前导通配符，无法使用索引
     */
    LEADING_WILDCARD,
    /**
     * WHERE 中对列使用函数，无法使用索引
     */
    FUNCTION_ON_COLUMN,
    ORDER_BY_WITHOUT_TOP
}
