package com.afsun.sqlanalyzer.core.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 词法单元类型
 *
 * @author afsun
 */
public enum TokenType {
    // 特殊
    ILLEGAL("ILLEGAL"),
    EOF("EOF"),

    // 标识符与字面量
    IDENT("IDENT"),
    NUMBER("NUMBER"),
    STRING("STRING"),

    // 运算符
    EQ("="),
    NOT_EQ("<>"),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">="),
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    SLASH("/"),

    // 分隔符
    COMMA(","),
    SEMICOLON(";"),
    DOT("."),
    LPAREN("("),
    RPAREN(")"),

    // 关键字
    SELECT("SELECT"),
    FROM("FROM"),
    WHERE("WHERE"),
    JOIN("JOIN"),
    INNER("INNER"),
    LEFT("LEFT"),
    RIGHT("RIGHT"),
    FULL("FULL"),
    ON("ON"),
    GROUP("GROUP"),
    BY("BY"),
    HAVING("HAVING"),
    ORDER("ORDER"),
    TOP("TOP"),
    DISTINCT("DISTINCT"),
    AS("AS"),
    AND("AND"),
    OR("OR"),
    LIKE("LIKE"),
    IN("IN"),
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    CREATE("CREATE"),
    DROP("DROP"),
    ALTER("ALTER");

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        for (TokenType type : values()) {
            if (type.ordinal() >= SELECT.ordinal()) {
                keywords.put(type.text, type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public boolean isKeyword() {
        return ordinal() >= SELECT.ordinal();
    }

    /**
     * 关键字识别（大小写不敏感），非关键字返回 IDENT
     */
    public static TokenType lookupIdent(String word) {
        TokenType type = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
        return type == null ? IDENT : type;
    }

    @Override
    public String toString() {
        return text;
    }
}
