package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.DeleteStatement;
import com.afsun.sqlanalyzer.core.ast.JoinType;
import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.ast.StatementType;
import com.afsun.sqlanalyzer.core.ast.TableReference;
import com.afsun.sqlanalyzer.core.parser.ParseResult;
import com.afsun.sqlanalyzer.core.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultQueryAnalyzerTest {

    private DefaultQueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DefaultQueryAnalyzer();
    }

    private AnalysisResult analyze(String sql) {
        ParseResult parsed = new Parser(sql).parseAll();
        assertTrue(parsed.isSuccess(), () -> "parse failed: " + parsed.getErrors());
        return analyzer.analyze(parsed.getStatements().get(0));
    }

    private static List<SuggestionType> types(AnalysisResult result) {
        return result.getSuggestions().stream().map(Suggestion::getType).collect(Collectors.toList());
    }

    @Test
    void testSimpleJoinQuery() {
        AnalysisResult result = analyze("SELECT u.name, o.total FROM users u JOIN orders o ON u.id = o.user_id");

        assertEquals(StatementType.SELECT, result.getQueryType());

        assertEquals(2, result.getTables().size());
        TableInfo users = result.getTables().get(0);
        assertEquals("users", users.getName());
        assertEquals("u", users.getAlias());
        assertNull(users.getSchema());
        assertEquals("SELECT", users.getUsage());
        assertEquals("orders", result.getTables().get(1).getName());

        assertEquals(4, result.getColumns().size());
        assertEquals(new ColumnInfo("u", "name", ColumnUsage.SELECT), result.getColumns().get(0));
        assertEquals(new ColumnInfo("o", "total", ColumnUsage.SELECT), result.getColumns().get(1));
        assertEquals(new ColumnInfo("u", "id", ColumnUsage.JOIN), result.getColumns().get(2));
        assertEquals(new ColumnInfo("o", "user_id", ColumnUsage.JOIN), result.getColumns().get(3));

        assertEquals(1, result.getJoins().size());
        JoinInfo join = result.getJoins().get(0);
        assertEquals(JoinType.INNER, join.getType());
        assertEquals("users", join.getLeftTable());
        assertEquals("orders", join.getRightTable());
        assertEquals("u.id = o.user_id", join.getCondition());

        assertEquals(2, result.getComplexityScore());
    }

    @Test
    void testColumnUsageByClause() {
        AnalysisResult result = analyze(
                "SELECT dept FROM emp WHERE salary > 10 GROUP BY dept HAVING COUNT(id) > 1 ORDER BY dept");

        List<ColumnUsage> usages = result.getColumns().stream().map(ColumnInfo::getUsage).collect(Collectors.toList());
        assertEquals(List.of(ColumnUsage.SELECT, ColumnUsage.WHERE, ColumnUsage.GROUP_BY,
                ColumnUsage.HAVING, ColumnUsage.ORDER_BY), usages);
    }

    @Test
    void testComplexityGrowsWithStructure() {
        int plain = analyze("SELECT a FROM t").getComplexityScore();
        int filtered = analyze("SELECT a FROM t WHERE a = 1").getComplexityScore();
        int twoConditions = analyze("SELECT a FROM t WHERE a = 1 AND b = 2").getComplexityScore();
        int full = analyze("SELECT a FROM t JOIN u ON t.id = u.id WHERE a = 1 AND b = 2 "
                + "GROUP BY a HAVING COUNT(*) > 1").getComplexityScore();

        assertEquals(1, plain);
        assertEquals(2, filtered);
        assertEquals(3, twoConditions);
        // 1 + JOIN 1 + WHERE 2 + GROUP BY 1 + HAVING 1 + COUNT 1
        assertEquals(7, full);
    }

    @Test
    void testLeftTableFromConditionQualifier() {
        AnalysisResult result = analyze("SELECT * FROM a JOIN b ON a.id = b.a_id JOIN c ON b.id = c.b_id "
                + "WHERE a.x = 1");

        assertEquals("a", result.getJoins().get(0).getLeftTable());
        assertEquals("b", result.getJoins().get(1).getLeftTable());
        assertEquals("c", result.getJoins().get(1).getRightTable());
    }

    @Test
    void testLeftTableMatchesAliasCaseInsensitively() {
        AnalysisResult result = analyze("SELECT * FROM dbo.customers C JOIN orders o ON o.cid = c.id WHERE 1 = 1");

        assertEquals("customers", result.getJoins().get(0).getLeftTable());
        assertEquals("dbo", result.getTables().get(0).getSchema());
    }

    @Test
    void testLeftTableFallsBackToLastVisibleTable() {
        AnalysisResult result = analyze("SELECT * FROM a, b LEFT JOIN c ON 1 = 1 WHERE a.x = b.x");

        assertEquals("b", result.getJoins().get(0).getLeftTable());
        assertEquals(JoinType.LEFT, result.getJoins().get(0).getType());
    }

    @Test
    void testComplexQuerySuggestion() {
        AnalysisResult result = analyze("SELECT a.id FROM a JOIN b ON a.id = b.id JOIN c ON b.id = c.id "
                + "JOIN d ON c.id = d.id JOIN e ON d.id = e.id WHERE a.id = 1");

        Suggestion suggestion = result.getSuggestions().stream()
                .filter(s -> s.getType() == SuggestionType.COMPLEX_QUERY)
                .findFirst().orElseThrow(AssertionError::new);
        assertEquals(Severity.INFO, suggestion.getSeverity());
        assertTrue(suggestion.getDescription().contains("4"));
    }

    @Test
    void testJoinThresholdIsConfigurable() {
        analyzer = new DefaultQueryAnalyzer(0);

        AnalysisResult result = analyze("SELECT a.id FROM a JOIN b ON a.id = b.id WHERE a.id = 1");

        assertTrue(types(result).contains(SuggestionType.COMPLEX_QUERY));
    }

    @Test
    void testSelectStarAndMissingWhere() {
        AnalysisResult result = analyze("SELECT * FROM a, b");

        List<SuggestionType> types = types(result);
        assertTrue(types.contains(SuggestionType.SELECT_STAR));
        assertTrue(types.contains(SuggestionType.MISSING_WHERE));
        assertTrue(result.getSuggestions().stream().allMatch(s -> s.getSeverity() == Severity.WARNING));
    }

    @Test
    void testLeadingWildcardAndFunctionOnColumn() {
        AnalysisResult result = analyze("SELECT TOP 5 id FROM t WHERE name LIKE '%son' AND UPPER(city) = 'OSLO' "
                + "ORDER BY id");

        List<SuggestionType> types = types(result);
        assertTrue(types.contains(SuggestionType.LEADING_WILDCARD));
        assertTrue(types.contains(SuggestionType.FUNCTION_ON_COLUMN));
        assertFalse(types.contains(SuggestionType.ORDER_BY_WITHOUT_TOP));
    }

    @Test
    void testOrderByWithoutTop() {
        AnalysisResult result = analyze("SELECT id FROM t WHERE name LIKE 'son%' ORDER BY id");

        assertEquals(List.of(SuggestionType.ORDER_BY_WITHOUT_TOP), types(result));
    }

    @Test
    void testCleanQueryHasNoSuggestions() {
        assertTrue(analyze("SELECT id, name FROM users WHERE id = 7").getSuggestions().isEmpty());
    }

    @Test
    void testStatementWithoutBodyReportsTargetTable() {
        DeleteStatement delete = new DeleteStatement();
        delete.setTable(TableReference.of("dbo", "logs", null));

        AnalysisResult result = analyzer.analyze(delete);

        assertEquals(StatementType.DELETE, result.getQueryType());
        assertEquals(1, result.getTables().size());
        assertEquals("DELETE", result.getTables().get(0).getUsage());
        assertEquals(1, result.getComplexityScore());
    }

    @Test
    void testResultIsImmutable() {
        AnalysisResult result = analyze("SELECT a FROM t");

        assertThrows(UnsupportedOperationException.class,
                () -> result.getTables().add(new TableInfo("x", null, null, "SELECT")));
    }

    @Test
    void testNullStatementRejected() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze((Statement) null));
    }
}
