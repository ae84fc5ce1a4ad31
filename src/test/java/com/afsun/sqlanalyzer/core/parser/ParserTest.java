package com.afsun.sqlanalyzer.core.parser;

import com.afsun.sqlanalyzer.core.ast.BinaryExpression;
import com.afsun.sqlanalyzer.core.ast.ColumnReference;
import com.afsun.sqlanalyzer.core.ast.FunctionCall;
import com.afsun.sqlanalyzer.core.ast.JoinClause;
import com.afsun.sqlanalyzer.core.ast.JoinType;
import com.afsun.sqlanalyzer.core.ast.Literal;
import com.afsun.sqlanalyzer.core.ast.SelectStatement;
import com.afsun.sqlanalyzer.core.ast.SortDirection;
import com.afsun.sqlanalyzer.core.ast.SqlRenderer;
import com.afsun.sqlanalyzer.core.ast.StarExpression;
import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.ast.TableReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static SelectStatement parseSingle(String sql) {
        ParseResult result = new Parser(sql).parseAll();
        assertTrue(result.getErrors().isEmpty(), () -> "unexpected errors: " + result.getErrors());
        assertEquals(1, result.getStatements().size());
        return assertInstanceOf(SelectStatement.class, result.getStatements().get(0));
    }

    @Test
    void testSelectWithJoin() {
        SelectStatement stmt = parseSingle("SELECT u.name, o.total FROM users u JOIN orders o ON u.id = o.user_id");

        assertEquals(2, stmt.getColumns().size());
        ColumnReference name = assertInstanceOf(ColumnReference.class, stmt.getColumns().get(0));
        assertEquals("u", name.getTable());
        assertEquals("name", name.getColumn());
        ColumnReference total = assertInstanceOf(ColumnReference.class, stmt.getColumns().get(1));
        assertEquals("o", total.getTable());
        assertEquals("total", total.getColumn());

        assertEquals(1, stmt.getFrom().getTables().size());
        assertEquals(TableReference.of(null, "users", "u"), stmt.getFrom().getTables().get(0));

        assertEquals(1, stmt.getJoins().size());
        JoinClause join = stmt.getJoins().get(0);
        assertEquals(JoinType.INNER, join.getJoinType());
        assertEquals(TableReference.of(null, "orders", "o"), join.getTable());
        assertEquals("u.id = o.user_id", SqlRenderer.render(join.getCondition()));
    }

    @Test
    void testTopPercentStar() {
        SelectStatement stmt = parseSingle("SELECT TOP 10 PERCENT * FROM t");

        assertNotNull(stmt.getTop());
        assertEquals(10, stmt.getTop().getCount());
        assertTrue(stmt.getTop().isPercent());
        assertEquals(1, stmt.getColumns().size());
        assertInstanceOf(StarExpression.class, stmt.getColumns().get(0));
    }

    @Test
    void testTopParenthesized() {
        SelectStatement stmt = parseSingle("SELECT TOP (5) a FROM t");

        assertEquals(5, stmt.getTop().getCount());
        assertFalse(stmt.getTop().isPercent());
    }

    @Test
    void testTopRequiresInteger() {
        ParseResult result = new Parser("SELECT TOP 1.5 a FROM t").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, result.getErrors().get(0).getKind());
    }

    @Test
    void testMultipleFromTablesWhereAndOrderBy() {
        SelectStatement stmt = parseSingle("SELECT a FROM t1, t2 WHERE a > 5 ORDER BY a DESC");

        assertEquals(2, stmt.getFrom().getTables().size());
        assertEquals("t1", stmt.getFrom().getTables().get(0).getName());
        assertEquals("t2", stmt.getFrom().getTables().get(1).getName());

        BinaryExpression where = assertInstanceOf(BinaryExpression.class, stmt.getWhere());
        assertEquals(">", where.getOperator());
        assertEquals(5L, ((Literal) where.getRight()).getValue());

        assertEquals(1, stmt.getOrderBy().size());
        assertEquals(SortDirection.DESC, stmt.getOrderBy().get(0).getDirection());
    }

    @Test
    void testMissingSelectListReportsFromPosition() {
        ParseResult result = new Parser("SELECT FROM t").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertFalse(result.getErrors().isEmpty());
        ParseError error = result.getErrors().get(0);
        assertEquals(ParseErrorKind.NO_PREFIX, error.getKind());
        assertEquals(1, error.getLine());
        assertEquals(8, error.getColumn());
        assertEquals("no prefix parse function for FROM found at line 1, column 8", error.getMessage());
    }

    @Test
    void testInsertIsReportedAsNotImplemented() {
        ParseResult result = new Parser("INSERT INTO t VALUES (1)").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertEquals(1, result.getErrors().size());
        ParseError error = result.getErrors().get(0);
        assertEquals(ParseErrorKind.UNSUPPORTED_STATEMENT, error.getKind());
        assertEquals("INSERT statement parsing not implemented yet at line 1, column 1", error.getMessage());
    }

    @Test
    void testUnknownStatementType() {
        ParseResult result = new Parser("DROP TABLE t").parseAll();

        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).getMessage().startsWith("unsupported statement type: DROP"));
    }

    @Test
    void testMultipleStatements() {
        ParseResult result = new Parser("SELECT a FROM t; SELECT b FROM u;").parseAll();

        assertTrue(result.isSuccess());
        assertEquals(2, result.getStatements().size());
    }

    @Test
    void testStatementsWithoutSemicolon() {
        ParseResult result = new Parser("SELECT a FROM t SELECT b FROM u").parseAll();

        assertTrue(result.isSuccess());
        assertEquals(2, result.getStatements().size());
    }

    @Test
    void testRecoveryAfterBrokenStatement() {
        ParseResult result = new Parser("SELECT 1 FROM; SELECT 2 FROM t").parseAll();

        assertEquals(1, result.getStatements().size());
        assertEquals(1, result.getErrors().size());
        assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, result.getErrors().get(0).getKind());
        assertEquals(14, result.getErrors().get(0).getColumn());
        assertEquals("SELECT 2 FROM t", SqlRenderer.render(result.getStatements().get(0)));
    }

    @Test
    void testRecoveryAcrossSeveralErrors() {
        String sql = "SELECT FROM a;\nSELECT x FROM b;\nINSERT INTO c VALUES (1);\nSELECT y FROM d";
        ParseResult result = new Parser(sql).parseAll();

        assertEquals(2, result.getStatements().size());
        assertEquals(2, result.getErrors().size());
        assertEquals(1, result.getErrors().get(0).getLine());
        assertEquals(3, result.getErrors().get(1).getLine());
    }

    @Test
    void testGroupWithoutByReportsSingleSyntaxError() {
        ParseResult result = new Parser("SELECT a FROM t GROUP a").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertEquals(1, result.getErrors().size());
        ParseError error = result.getErrors().get(0);
        assertEquals(ParseErrorKind.SYNTAX, error.getKind());
        assertEquals("expected next token to be BY, got IDENT instead at line 1, column 23", error.getMessage());
    }

    @Test
    void testTrailingTokenKeepsStatement() {
        ParseResult result = new Parser("SELECT a FROM t x y").parseAll();

        assertEquals(1, result.getStatements().size());
        assertEquals(1, result.getErrors().size());
        assertEquals("y", result.getErrors().get(0).getActual());
    }

    @Test
    void testJoinTypesKeepSourceOrder() {
        SelectStatement stmt = parseSingle("SELECT * FROM a"
                + " INNER JOIN b ON a.x = b.x"
                + " LEFT OUTER JOIN c ON b.y = c.y"
                + " RIGHT JOIN d ON c.z = d.z"
                + " FULL JOIN e ON d.w = e.w"
                + " JOIN f ON e.v = f.v");

        List<JoinClause> joins = stmt.getJoins();
        assertEquals(5, joins.size());
        assertEquals(JoinType.INNER, joins.get(0).getJoinType());
        assertEquals(JoinType.LEFT, joins.get(1).getJoinType());
        assertEquals(JoinType.RIGHT, joins.get(2).getJoinType());
        assertEquals(JoinType.FULL, joins.get(3).getJoinType());
        assertEquals(JoinType.INNER, joins.get(4).getJoinType());
        assertEquals("c", joins.get(1).getTable().getName());
        assertEquals("f", joins.get(4).getTable().getName());
    }

    @Test
    void testJoinWithoutOn() {
        ParseResult result = new Parser("SELECT * FROM a JOIN b WHERE a.x = 1").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertEquals("ON after JOIN table", result.getErrors().get(0).getExpected());
    }

    @Test
    void testFlatLeftToRightExpression() {
        SelectStatement stmt = parseSingle("SELECT a + b * c FROM t");

        BinaryExpression outer = assertInstanceOf(BinaryExpression.class, stmt.getColumns().get(0));
        assertEquals("*", outer.getOperator());
        BinaryExpression inner = assertInstanceOf(BinaryExpression.class, outer.getLeft());
        assertEquals("+", inner.getOperator());
        assertEquals("c", ((ColumnReference) outer.getRight()).getColumn());
    }

    @Test
    void testGroupedExpressionOverridesOrder() {
        SelectStatement stmt = parseSingle("SELECT a + (b * c) FROM t");

        BinaryExpression outer = assertInstanceOf(BinaryExpression.class, stmt.getColumns().get(0));
        assertEquals("+", outer.getOperator());
        assertInstanceOf(BinaryExpression.class, outer.getRight());
        assertEquals("a + (b * c)", SqlRenderer.render(outer));
    }

    @Test
    void testFunctionCallsAndLiterals() {
        SelectStatement stmt = parseSingle(
                "SELECT COUNT(*), MAX(price), GETDATE() FROM t WHERE name LIKE 'A%' AND qty > -5 AND rate < 0.5");

        FunctionCall count = assertInstanceOf(FunctionCall.class, stmt.getColumns().get(0));
        assertEquals("COUNT", count.getName());
        assertInstanceOf(StarExpression.class, count.getArguments().get(0));
        FunctionCall now = assertInstanceOf(FunctionCall.class, stmt.getColumns().get(2));
        assertTrue(now.getArguments().isEmpty());

        assertEquals("name LIKE 'A%' AND qty > -5 AND rate < 0.5", SqlRenderer.render(stmt.getWhere()));
    }

    @Test
    void testGroupByHavingOrderBy() {
        SelectStatement stmt = parseSingle(
                "SELECT dept, COUNT(*) FROM emp GROUP BY dept, region HAVING COUNT(*) > 1 ORDER BY dept, region desc");

        assertEquals(2, stmt.getGroupBy().size());
        assertNotNull(stmt.getHaving());
        assertEquals(2, stmt.getOrderBy().size());
        assertEquals(SortDirection.ASC, stmt.getOrderBy().get(0).getDirection());
        assertEquals(SortDirection.DESC, stmt.getOrderBy().get(1).getDirection());
    }

    @Test
    void testSchemaQualifiedTablesAndQualifiedStar() {
        SelectStatement stmt = parseSingle("SELECT DISTINCT u.* FROM [dbo].[users] AS u");

        assertTrue(stmt.isDistinct());
        StarExpression star = assertInstanceOf(StarExpression.class, stmt.getColumns().get(0));
        assertEquals("u", star.getTable());
        assertEquals(TableReference.of("dbo", "users", "u"), stmt.getFrom().getTables().get(0));
    }

    @Test
    void testRenderedStatementParsesToSameTree() {
        String sql = "select top 3 u.name, o.total from dbo.users u left join orders o on u.id = o.user_id "
                + "where o.total > 10 or u.vip = 1 group by u.name having count(*) > 2 order by u.name desc";
        String rendered = SqlRenderer.render(parseSingle(sql));

        assertEquals(rendered, SqlRenderer.render(parseSingle(rendered)));
    }

    @Test
    void testParseStatementReturnsNullOnError() {
        Parser parser = new Parser("SELECT a FROM");

        assertNull(parser.parseStatement());
        assertEquals(1, parser.getErrors().size());
    }

    @Test
    void testEmptyInput() {
        ParseResult result = new Parser("  -- nothing here\n").parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertTrue(result.getErrors().isEmpty());
        assertFalse(result.isSuccess());
    }

    @Test
    void testCancelledBeforeStart() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        Parser parser = new Parser("SELECT a FROM t; SELECT b FROM u", new ParseContext(), token);

        ParseResult result = parser.parseAll();

        assertTrue(result.getStatements().isEmpty());
        assertEquals(1, result.getErrors().size());
        assertEquals(ParseErrorKind.CANCELLED, result.getErrors().get(0).getKind());
        assertEquals("parsing cancelled due to timeout", result.getErrors().get(0).getMessage());
    }

    @Test
    void testExpiredDeadlineCancels() throws InterruptedException {
        CancellationToken token = CancellationToken.withTimeout(java.time.Duration.ofMillis(1));
        Thread.sleep(5);

        ParseResult result = new Parser("SELECT a FROM t", new ParseContext(), token).parseAll();

        assertTrue(token.isCancelled());
        assertEquals(ParseErrorKind.CANCELLED, result.getErrors().get(0).getKind());
    }

    @Test
    void testCancellationAtAnyPointReturnsAllNodesToPool() {
        String sql = "SELECT t.a, (b + c), COUNT(d) FROM t JOIN u ON t.id = u.id "
                + "WHERE (x) = 1 GROUP BY t.a HAVING (t.a) > 0 ORDER BY t.a DESC, e ASC";
        boolean sawCancelled = false;
        boolean sawComplete = false;
        for (int limit = 0; limit < 80; limit++) {
            ParseContext context = new ParseContext();
            ParseResult result = new Parser(sql, context, cancelAfter(limit)).parseAll();
            if (result.hasErrors()) {
                sawCancelled = true;
                assertEquals(ParseErrorKind.CANCELLED, result.getErrors().get(0).getKind());
            } else {
                sawComplete = true;
            }
            for (Statement statement : result.getStatements()) {
                context.getNodePool().release(statement);
            }

            NodePool pool = context.getNodePool();
            assertEquals(pool.getCreatedCount(), pool.getFreeCount(), "nodes lost when cancelled after " + limit);
        }
        assertTrue(sawCancelled);
        assertTrue(sawComplete);
    }

    private static CancellationToken cancelAfter(int polls) {
        return new CancellationToken(0L, true) {
            private int seen;

            @Override
            public boolean isCancelled() {
                return ++seen > polls;
            }
        };
    }

    @Test
    void testNoneTokenCannotBeCancelled() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancelled());
    }

    @Test
    void testMetrics() {
        ParseResult result = new Parser("SELECT a, b FROM t WHERE a = 1; SELECT FROM").parseAll();

        ParseMetrics metrics = result.getMetrics();
        assertTrue(metrics.getTokensProcessed() > 10);
        assertTrue(metrics.getTokensPerSecond() > 0);
        assertEquals(result.getErrors().size(), metrics.getErrorCount());

        Map<String, Object> map = metrics.toMap();
        assertTrue(map.containsKey("parse_duration_ms"));
        assertTrue(map.containsKey("tokens_processed"));
        assertTrue(map.containsKey("tokens_per_second"));
        assertEquals(1, ((Number) map.get("error_count")).intValue());
    }

    @Test
    void testPooledNodesAreReusedAcrossParses() {
        ParseContext context = new ParseContext();
        String sql = "SELECT a, b FROM t JOIN u ON t.id = u.id WHERE a = 1";

        ParseResult first = new Parser(sql, context, CancellationToken.NONE).parseAll();
        String rendered = SqlRenderer.render(first.getStatements().get(0));
        long created = context.getNodePool().getCreatedCount();
        for (Statement statement : first.getStatements()) {
            context.getNodePool().release(statement);
        }

        ParseResult second = new Parser(sql, context, CancellationToken.NONE).parseAll();

        assertEquals(rendered, SqlRenderer.render(second.getStatements().get(0)));
        assertEquals(created, context.getNodePool().getCreatedCount());
        assertEquals(created, context.getNodePool().getReusedCount());
    }

    @Test
    void testFailedStatementReturnsNodesToPool() {
        ParseContext context = new ParseContext();

        ParseResult result = new Parser("SELECT a, b FROM", context, CancellationToken.NONE).parseAll();

        assertTrue(result.getStatements().isEmpty());
        NodePool pool = context.getNodePool();
        assertEquals(3, pool.getCreatedCount());
        assertEquals(3, pool.getFreeCount());
    }
}
