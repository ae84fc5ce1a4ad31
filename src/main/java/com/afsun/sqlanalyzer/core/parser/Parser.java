package com.afsun.sqlanalyzer.core.parser;

import com.afsun.sqlanalyzer.core.ast.BinaryExpression;
import com.afsun.sqlanalyzer.core.ast.ColumnReference;
import com.afsun.sqlanalyzer.core.ast.Expression;
import com.afsun.sqlanalyzer.core.ast.FromClause;
import com.afsun.sqlanalyzer.core.ast.FunctionCall;
import com.afsun.sqlanalyzer.core.ast.JoinClause;
import com.afsun.sqlanalyzer.core.ast.JoinType;
import com.afsun.sqlanalyzer.core.ast.Literal;
import com.afsun.sqlanalyzer.core.ast.OrderByClause;
import com.afsun.sqlanalyzer.core.ast.SelectStatement;
import com.afsun.sqlanalyzer.core.ast.SortDirection;
import com.afsun.sqlanalyzer.core.ast.StarExpression;
import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.ast.TableReference;
import com.afsun.sqlanalyzer.core.ast.TopClause;
import com.afsun.sqlanalyzer.core.exceptions.SqlParseException;
import com.afsun.sqlanalyzer.core.lexer.Token;
import com.afsun.sqlanalyzer.core.lexer.TokenType;
import com.afsun.sqlanalyzer.core.lexer.Tokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SQL Server 方言递归下降解析器（单词法单元预读）
 * <p>
 * 公开方法不抛异常：诊断累积在错误列表中。单条语句失败时归还未完成的节点，
 * 跳到下一个语句边界（分号或语句关键字）后继续解析。
 * 表达式按中缀运算符从左到右平铺结合，没有优先级：a + b * c 解析为 (a + b) * c。
 * <p>
 * 一个实例只解析一段输入，且只能由一个线程使用。
 *
 * @author afsun
 */
@Slf4j
public class Parser {

    private final Tokenizer tokenizer;
    private final NodePool pool;
    private final CancellationToken cancellation;
    private final List<ParseError> errors = new ArrayList<>(4);

    private final long startNanos;
    private int tokenCount;
    private boolean cancelled;

    private Token current;
    private Token peek;

    public Parser(String sql) {
        this(sql, new ParseContext(), CancellationToken.NONE);
    }

    public Parser(String sql, ParseContext context, CancellationToken cancellation) {
        this.startNanos = System.nanoTime();
        this.tokenizer = new Tokenizer(sql);
        this.pool = context.getNodePool();
        this.cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
        // 预读两个词法单元，使 current 与 peek 都有值
        this.peek = tokenizer.next();
        this.current = peek;
        this.peek = tokenizer.next();
        this.tokenCount = 2;
    }

    /**
     * 解析分号分隔的多条语句
     */
    public ParseResult parseAll() {
        List<Statement> statements = new ArrayList<>();
        boolean recovering = false;
        while (!cancelled && !curTokenIs(TokenType.EOF)) {
            try {
                if (recovering) {
                    recovering = false;
                    synchronize();
                    continue;
                }
                if (curTokenIs(TokenType.SEMICOLON)) {
                    advance();
                    continue;
                }
                statements.add(parseStatementOrThrow());
                if (!curTokenIs(TokenType.SEMICOLON) && !curTokenIs(TokenType.EOF) && !isStatementStart()) {
                    errors.add(ParseError.unexpectedToken(current, "';' or end of statement"));
                    recovering = true;
                }
            } catch (SqlParseException e) {
                if (!e.isReported()) {
                    errors.add(e.getError());
                }
                if (e.isCancellation()) {
                    break;
                }
                log.debug("语句解析失败，跳转到下一语句边界: {}", e.getError().getMessage());
                recovering = true;
            }
        }
        return new ParseResult(statements, new ArrayList<>(errors), getMetrics());
    }

    /**
     * 解析当前位置的一条语句，失败时返回 null，诊断见 {@link #getErrors()}
     */
    public Statement parseStatement() {
        if (cancelled) {
            return null;
        }
        try {
            return parseStatementOrThrow();
        } catch (SqlParseException e) {
            if (!e.isReported()) {
                errors.add(e.getError());
            }
            return null;
        }
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public ParseMetrics getMetrics() {
        long elapsedNanos = Math.max(System.nanoTime() - startNanos, 1L);
        double tokensPerSecond = tokenCount / (elapsedNanos / 1_000_000_000d);
        return new ParseMetrics(elapsedNanos / 1_000_000L, tokenCount, tokensPerSecond, errors.size());
    }

    private Statement parseStatementOrThrow() {
        switch (current.getType()) {
            case SELECT:
                return parseSelectStatement();
            case INSERT:
            case UPDATE:
            case DELETE:
                throw new SqlParseException(ParseError.unsupportedStatement(current,
                        current.getType().getText() + " statement parsing not implemented yet"));
            default:
                throw new SqlParseException(ParseError.unsupportedStatement(current,
                        "unsupported statement type: " + current.getLiteral()));
        }
    }

    private SelectStatement parseSelectStatement() {
        SelectStatement stmt = pool.acquireSelect();
        try {
            advance();

            if (curTokenIs(TokenType.DISTINCT)) {
                stmt.setDistinct(true);
                advance();
            }

            if (curTokenIs(TokenType.TOP)) {
                stmt.setTop(parseTopClause());
            }

            parseSelectList(stmt.getColumns());

            if (curTokenIs(TokenType.FROM)) {
                stmt.setFrom(parseFromClause());
            }

            while (isJoinStart()) {
                stmt.getJoins().add(parseJoinClause());
            }

            if (curTokenIs(TokenType.WHERE)) {
                advance();
                stmt.setWhere(parseExpression());
            }

            if (curTokenIs(TokenType.GROUP)) {
                parseGroupByClause(stmt.getGroupBy());
            }

            if (curTokenIs(TokenType.HAVING)) {
                advance();
                stmt.setHaving(parseExpression());
            }

            if (curTokenIs(TokenType.ORDER)) {
                parseOrderByClause(stmt.getOrderBy());
            }
            return stmt;
        } catch (SqlParseException e) {
            pool.release(stmt);
            throw e;
        }
    }

    /**
     * TOP n [PERCENT]，也接受 TOP (n)
     */
    private TopClause parseTopClause() {
        advance();
        boolean parenthesized = curTokenIs(TokenType.LPAREN);
        if (parenthesized) {
            advance();
        }
        if (!curTokenIs(TokenType.NUMBER) || current.getLiteral().contains(".")) {
            throw unexpected("integer after TOP");
        }
        int count;
        try {
            count = Integer.parseInt(current.getLiteral());
        } catch (NumberFormatException e) {
            throw unexpected("integer after TOP");
        }
        advance();
        if (parenthesized) {
            if (!curTokenIs(TokenType.RPAREN)) {
                throw unexpected("')' after TOP count");
            }
            advance();
        }
        boolean percent = false;
        if (curTokenIs(TokenType.IDENT) && "PERCENT".equalsIgnoreCase(current.getLiteral())) {
            percent = true;
            advance();
        }
        return new TopClause(count, percent);
    }

    private void parseSelectList(List<Expression> columns) {
        columns.add(parseSelectItem());
        while (curTokenIs(TokenType.COMMA)) {
            advance();
            columns.add(parseSelectItem());
        }
    }

    private Expression parseSelectItem() {
        if (curTokenIs(TokenType.ASTERISK)) {
            advance();
            return new StarExpression();
        }
        return parseExpression();
    }

    private FromClause parseFromClause() {
        advance();
        FromClause from = new FromClause();
        from.getTables().add(parseTableReference());
        while (curTokenIs(TokenType.COMMA)) {
            advance();
            from.getTables().add(parseTableReference());
        }
        return from;
    }

    /**
     * [schema.]name [[AS] alias]
     */
    private TableReference parseTableReference() {
        if (!curTokenIs(TokenType.IDENT)) {
            throw unexpected("table name");
        }
        String schema = null;
        String name = current.getLiteral();
        advance();

        if (curTokenIs(TokenType.DOT)) {
            advance();
            if (!curTokenIs(TokenType.IDENT)) {
                throw unexpected("table name after '.'");
            }
            schema = name;
            name = current.getLiteral();
            advance();
        }

        String alias = null;
        if (curTokenIs(TokenType.AS)) {
            advance();
            if (!curTokenIs(TokenType.IDENT)) {
                throw unexpected("alias after AS");
            }
            alias = current.getLiteral();
            advance();
        } else if (curTokenIs(TokenType.IDENT)) {
            // 省略 AS 的隐式别名
            alias = current.getLiteral();
            advance();
        }
        return TableReference.of(schema, name, alias);
    }

    private JoinClause parseJoinClause() {
        JoinClause join = pool.acquireJoin();
        try {
            if (curTokenIs(TokenType.JOIN)) {
                join.setJoinType(JoinType.INNER);
            } else {
                join.setJoinType(JoinType.valueOf(current.getType().name()));
                if (peekTokenIs(TokenType.IDENT) && "OUTER".equalsIgnoreCase(peek.getLiteral())) {
                    advance();
                }
                if (!expectPeek(TokenType.JOIN)) {
                    throw abort();
                }
            }
            advance();

            join.setTable(parseTableReference());

            if (!curTokenIs(TokenType.ON)) {
                throw unexpected("ON after JOIN table");
            }
            advance();
            join.setCondition(parseExpression());
            return join;
        } catch (SqlParseException e) {
            pool.release(join);
            throw e;
        }
    }

    private void parseGroupByClause(List<Expression> groupBy) {
        if (!expectPeek(TokenType.BY)) {
            throw abort();
        }
        advance();
        groupBy.add(parseExpression());
        while (curTokenIs(TokenType.COMMA)) {
            advance();
            groupBy.add(parseExpression());
        }
    }

    private void parseOrderByClause(List<OrderByClause> orderBy) {
        if (!expectPeek(TokenType.BY)) {
            throw abort();
        }
        advance();
        orderBy.add(parseOrderByItem());
        while (curTokenIs(TokenType.COMMA)) {
            advance();
            orderBy.add(parseOrderByItem());
        }
    }

    private OrderByClause parseOrderByItem() {
        Expression expr = parseExpression();
        SortDirection direction = SortDirection.ASC;
        if (curTokenIs(TokenType.IDENT)) {
            String word = current.getLiteral().toUpperCase(Locale.ROOT);
            if ("ASC".equals(word) || "DESC".equals(word)) {
                direction = SortDirection.valueOf(word);
                try {
                    advance();
                } catch (SqlParseException e) {
                    pool.release(expr);
                    throw e;
                }
            }
        }
        return new OrderByClause(expr, direction);
    }

    // ===== 表达式 =====

    private Expression parseExpression() {
        Expression left = parsePrimaryExpression();
        try {
            while (isInfixOperator(current.getType())) {
                // != 与 <> 统一为 <>，关键字运算符统一为大写
                String operator = current.getType().getText();
                advance();
                Expression right = parsePrimaryExpression();

                BinaryExpression expr = pool.acquireBinary();
                expr.setLeft(left);
                expr.setOperator(operator);
                expr.setRight(right);
                left = expr;
            }
            return left;
        } catch (SqlParseException e) {
            pool.release(left);
            throw e;
        }
    }

    private Expression parsePrimaryExpression() {
        switch (current.getType()) {
            case IDENT:
                return parseIdentifierExpression();
            case NUMBER:
                return parseNumberLiteral(false);
            case STRING:
                Literal literal = Literal.ofString(current.getLiteral());
                advance();
                return literal;
            case ASTERISK:
                advance();
                return new StarExpression();
            case LPAREN:
                return parseGroupedExpression();
            case MINUS:
                if (peekTokenIs(TokenType.NUMBER)) {
                    advance();
                    return parseNumberLiteral(true);
                }
                throw new SqlParseException(ParseError.noPrefix(current));
            default:
                throw new SqlParseException(ParseError.noPrefix(current));
        }
    }

    private Expression parseIdentifierExpression() {
        String firstIdent = current.getLiteral();
        advance();

        // 限定列 t.col 或 t.*
        if (curTokenIs(TokenType.DOT)) {
            advance();
            if (curTokenIs(TokenType.ASTERISK)) {
                advance();
                return new StarExpression(firstIdent);
            }
            if (!curTokenIs(TokenType.IDENT)) {
                throw unexpected("column name after '.'");
            }
            // 先推进再取节点，推进时被取消不会遗留池化节点
            String columnName = current.getLiteral();
            advance();
            ColumnReference column = pool.acquireColumn();
            column.setTable(firstIdent);
            column.setColumn(columnName);
            return column;
        }

        if (curTokenIs(TokenType.LPAREN)) {
            return parseFunctionCall(firstIdent);
        }

        ColumnReference column = pool.acquireColumn();
        column.setColumn(firstIdent);
        return column;
    }

    private Expression parseFunctionCall(String name) {
        advance();
        List<Expression> arguments = new ArrayList<>();
        try {
            if (!curTokenIs(TokenType.RPAREN)) {
                arguments.add(parseExpression());
                while (curTokenIs(TokenType.COMMA)) {
                    advance();
                    arguments.add(parseExpression());
                }
            }
            if (!curTokenIs(TokenType.RPAREN)) {
                throw unexpected("')' to close function call");
            }
            advance();
        } catch (SqlParseException e) {
            arguments.forEach(pool::release);
            throw e;
        }
        return new FunctionCall(name, arguments);
    }

    private Expression parseNumberLiteral(boolean negative) {
        String text = negative ? "-" + current.getLiteral() : current.getLiteral();
        Literal literal;
        try {
            literal = text.contains(".")
                    ? Literal.ofFloat(Double.parseDouble(text))
                    : Literal.ofInteger(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw unexpected("valid number");
        }
        advance();
        return literal;
    }

    private Expression parseGroupedExpression() {
        advance();
        Expression expr = parseExpression();
        if (!curTokenIs(TokenType.RPAREN)) {
            pool.release(expr);
            throw unexpected("')' to close grouped expression");
        }
        try {
            advance();
        } catch (SqlParseException e) {
            pool.release(expr);
            throw e;
        }
        return expr;
    }

    private static boolean isInfixOperator(TokenType type) {
        switch (type) {
            case EQ:
            case NOT_EQ:
            case LT:
            case GT:
            case LTE:
            case GTE:
            case AND:
            case OR:
            case PLUS:
            case MINUS:
            case ASTERISK:
            case SLASH:
            case LIKE:
            case IN:
                return true;
            default:
                return false;
        }
    }

    // ===== 词法单元推进与错误恢复 =====

    /**
     * 推进一个词法单元；取消信号已置位时中止当前输入的解析
     */
    private void advance() {
        if (cancelled || cancellation.isCancelled()) {
            cancelled = true;
            throw new SqlParseException(ParseError.cancelled(current));
        }
        current = peek;
        peek = tokenizer.next();
        tokenCount++;
    }

    /**
     * 预读匹配则推进并返回 true；否则记录语法错误并返回 false，不推进
     */
    private boolean expectPeek(TokenType type) {
        if (peekTokenIs(type)) {
            advance();
            return true;
        }
        errors.add(ParseError.syntax(type, peek));
        return false;
    }

    /**
     * 丢弃词法单元直到语句结束符（消费掉）或下一个语句关键字
     */
    private void synchronize() {
        advance();
        while (!curTokenIs(TokenType.EOF)) {
            if (curTokenIs(TokenType.SEMICOLON)) {
                advance();
                return;
            }
            if (isStatementStart()) {
                return;
            }
            advance();
        }
    }

    private boolean isStatementStart() {
        switch (current.getType()) {
            case SELECT:
            case INSERT:
            case UPDATE:
            case DELETE:
            case CREATE:
            case DROP:
            case ALTER:
                return true;
            default:
                return false;
        }
    }

    private boolean isJoinStart() {
        switch (current.getType()) {
            case JOIN:
            case INNER:
            case LEFT:
            case RIGHT:
            case FULL:
                return true;
            default:
                return false;
        }
    }

    private boolean curTokenIs(TokenType type) {
        return current.is(type);
    }

    private boolean peekTokenIs(TokenType type) {
        return peek.is(type);
    }

    private SqlParseException unexpected(String expected) {
        return new SqlParseException(ParseError.unexpectedToken(current, expected));
    }

    /**
     * expectPeek 已记录诊断，仅中止当前产生式
     */
    private SqlParseException abort() {
        return SqlParseException.alreadyReported(errors.get(errors.size() - 1));
    }
}
