package com.afsun.sqlanalyzer.core.parser;

import com.afsun.sqlanalyzer.core.lexer.Token;
import com.afsun.sqlanalyzer.core.lexer.TokenType;
import lombok.Data;

/**
 * 带位置信息的解析诊断
 *
 * @author afsun
 */
@Data
public class ParseError {
    private final ParseErrorKind kind;
    private final String message;
    /**
     * 期望的词法单元，仅 SYNTAX 类诊断有值
     */
    private final String expected;
    private final String actual;
    private final int line;
    private final int column;

    private ParseError(ParseErrorKind kind, String message, String expected, String actual, int line, int column) {
        this.kind = kind;
        this.message = message;
        this.expected = expected;
        this.actual = actual;
        this.line = line;
        this.column = column;
    }

    public static ParseError syntax(TokenType expected, Token actual) {
        String msg = String.format("expected next token to be %s, got %s instead at line %d, column %d",
                expected, actual.getType(), actual.getLine(), actual.getColumn());
        return new ParseError(ParseErrorKind.SYNTAX, msg, expected.getText(), actual.getType().getText(),
                actual.getLine(), actual.getColumn());
    }

    public static ParseError noPrefix(Token token) {
        String msg = String.format("no prefix parse function for %s found at line %d, column %d",
                token.getType(), token.getLine(), token.getColumn());
        return new ParseError(ParseErrorKind.NO_PREFIX, msg, null, token.getType().getText(),
                token.getLine(), token.getColumn());
    }

    public static ParseError unexpectedToken(Token token, String expected) {
        String msg = String.format("unexpected token '%s' at line %d, column %d. Expected: %s",
                token.getLiteral(), token.getLine(), token.getColumn(), expected);
        return new ParseError(ParseErrorKind.UNEXPECTED_TOKEN, msg, expected, token.getLiteral(),
                token.getLine(), token.getColumn());
    }

    public static ParseError unsupportedStatement(Token token, String message) {
        return new ParseError(ParseErrorKind.UNSUPPORTED_STATEMENT,
                message + " at line " + token.getLine() + ", column " + token.getColumn(),
                null, token.getLiteral(), token.getLine(), token.getColumn());
    }

    public static ParseError cancelled(Token token) {
        return new ParseError(ParseErrorKind.CANCELLED, "parsing cancelled due to timeout",
                null, token.getLiteral(), token.getLine(), token.getColumn());
    }

    @Override
    public String toString() {
        return message;
    }
}
