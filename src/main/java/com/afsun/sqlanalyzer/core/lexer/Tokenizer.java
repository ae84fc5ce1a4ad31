package com.afsun.sqlanalyzer.core.lexer;

/**
 * SQL Server 方言词法分析器
 * 单向扫描，不回溯；到达输入末尾后重复返回 EOF
 * 支持：
 * - 单行注释：-- comment
 * - 多行注释：/* comment *\/
 * - 方括号/双引号标识符：[dbo].[users]、"users"
 *
 * @author afsun
 */
public class Tokenizer {

    private final String input;
    private final int length;

    private int position;
    private int line = 1;
    private int column = 1;

    public Tokenizer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
    }

    public Token next() {
        skipWhitespaceAndComments();

        int startLine = line;
        int startColumn = column;
        if (position >= length) {
            return new Token(TokenType.EOF, "", startLine, startColumn);
        }

        char c = input.charAt(position);
        switch (c) {
            case '=':
                return single(TokenType.EQ, startLine, startColumn);
            case '+':
                return single(TokenType.PLUS, startLine, startColumn);
            case '-':
                return single(TokenType.MINUS, startLine, startColumn);
            case '*':
                return single(TokenType.ASTERISK, startLine, startColumn);
            case '/':
                return single(TokenType.SLASH, startLine, startColumn);
            case ',':
                return single(TokenType.COMMA, startLine, startColumn);
            case ';':
                return single(TokenType.SEMICOLON, startLine, startColumn);
            case '(':
                return single(TokenType.LPAREN, startLine, startColumn);
            case ')':
                return single(TokenType.RPAREN, startLine, startColumn);
            case '<':
                if (peekChar() == '=') {
                    return pair(TokenType.LTE, startLine, startColumn);
                }
                if (peekChar() == '>') {
                    return pair(TokenType.NOT_EQ, startLine, startColumn);
                }
                return single(TokenType.LT, startLine, startColumn);
            case '>':
                if (peekChar() == '=') {
                    return pair(TokenType.GTE, startLine, startColumn);
                }
                return single(TokenType.GT, startLine, startColumn);
            case '!':
                if (peekChar() == '=') {
                    return pair(TokenType.NOT_EQ, startLine, startColumn);
                }
                return single(TokenType.ILLEGAL, startLine, startColumn);
            case '\'':
                return readString(startLine, startColumn);
            case '[':
                return readDelimitedIdent(']', startLine, startColumn);
            case '"':
                return readDelimitedIdent('"', startLine, startColumn);
            case '.':
                // .5 这种写法按数字处理
                if (isDigit(peekChar())) {
                    return readNumber(startLine, startColumn);
                }
                return single(TokenType.DOT, startLine, startColumn);
            default:
                break;
        }

        if (isIdentStart(c)) {
            return readIdentifier(startLine, startColumn);
        }
        if (isDigit(c)) {
            return readNumber(startLine, startColumn);
        }
        return single(TokenType.ILLEGAL, startLine, startColumn);
    }

    private Token single(TokenType type, int startLine, int startColumn) {
        String literal = input.substring(position, position + 1);
        advanceChar();
        return new Token(type, literal, startLine, startColumn);
    }

    private Token pair(TokenType type, int startLine, int startColumn) {
        String literal = input.substring(position, position + 2);
        advanceChar();
        advanceChar();
        return new Token(type, literal, startLine, startColumn);
    }

    private Token readIdentifier(int startLine, int startColumn) {
        int start = position;
        while (position < length && isIdentPart(input.charAt(position))) {
            advanceChar();
        }
        String word = input.substring(start, position);
        return new Token(TokenType.lookupIdent(word), word, startLine, startColumn);
    }

    private Token readNumber(int startLine, int startColumn) {
        int start = position;
        boolean seenDot = false;
        while (position < length) {
            char c = input.charAt(position);
            if (isDigit(c)) {
                advanceChar();
            } else if (c == '.' && !seenDot && isDigit(peekChar())) {
                seenDot = true;
                advanceChar();
            } else {
                break;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, position), startLine, startColumn);
    }

    /**
     * 字符串字面量：保留引号内原文，'' 不结束字面量
     */
    private Token readString(int startLine, int startColumn) {
        advanceChar();
        int start = position;
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\'') {
                if (peekChar() == '\'') {
                    advanceChar();
                    advanceChar();
                    continue;
                }
                String content = input.substring(start, position);
                advanceChar();
                return new Token(TokenType.STRING, content, startLine, startColumn);
            }
            advanceChar();
        }
        // 未闭合
        return new Token(TokenType.ILLEGAL, input.substring(start - 1, position), startLine, startColumn);
    }

    /**
     * 定界标识符：[x] 或 "x"，定界符重复两次表示其本身，如 [a]]b] 为 a]b
     */
    private Token readDelimitedIdent(char close, int startLine, int startColumn) {
        int open = position;
        advanceChar();
        StringBuilder name = new StringBuilder();
        while (position < length) {
            char c = input.charAt(position);
            if (c == close) {
                if (peekChar() != close) {
                    advanceChar();
                    return new Token(TokenType.IDENT, name.toString(), startLine, startColumn);
                }
                advanceChar();
            }
            name.append(c);
            advanceChar();
        }
        return new Token(TokenType.ILLEGAL, input.substring(open, position), startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (position < length) {
            char c = input.charAt(position);
            if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '-' && peekChar() == '-') {
                while (position < length && input.charAt(position) != '\n') {
                    advanceChar();
                }
            } else if (c == '/' && peekChar() == '*') {
                advanceChar();
                advanceChar();
                while (position < length && !(input.charAt(position) == '*' && peekChar() == '/')) {
                    advanceChar();
                }
                if (position < length) {
                    advanceChar();
                    advanceChar();
                }
            } else {
                return;
            }
        }
    }

    private void advanceChar() {
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private char peekChar() {
        return position + 1 < length ? input.charAt(position + 1) : '\0';
    }

    /**
     * 不加定界符也能原样词法化为同一个 IDENT 的名称
     */
    public static boolean isPlainIdentifier(String name) {
        if (name == null || name.isEmpty() || !isIdentStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentPart(name.charAt(i))) {
                return false;
            }
        }
        return !TokenType.lookupIdent(name).isKeyword();
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '@' || c == '#';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '#' || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
