package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

/**
 * 表引用：[schema.]name [[AS] alias]
 *
 * @author afsun
 */
@Data
public class TableReference implements Node {
    private final String schema;
    private final String name;
    private final String alias;

    public static TableReference of(String schema, String name, String alias) {
        return new TableReference(schema, name, alias);
    }

    /**
     * 列限定符匹配：别名优先，其次表名（大小写不敏感）
     */
    public boolean matches(String qualifier) {
        return qualifier != null && getReferenceName().equalsIgnoreCase(qualifier);
    }

    /**
     * 别名存在时返回别名，否则返回表名
     */
    public String getReferenceName() {
        return alias != null ? alias : name;
    }
}
