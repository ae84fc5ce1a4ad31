package com.afsun.sqlanalyzer.core.lexer;

import lombok.Data;

/**
 * 词法单元，生成后不可变
 *
 * @author afsun
 */
@Data
public class Token {
    private final TokenType type;
    private final String literal;
    /**
     * 从1开始的行号
     */
    private final int line;
    /**
     * 从1开始的列号
     */
    private final int column;

    public boolean is(TokenType t) {
        return type == t;
    }
}
