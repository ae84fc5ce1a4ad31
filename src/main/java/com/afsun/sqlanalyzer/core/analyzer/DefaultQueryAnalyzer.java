package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.BinaryExpression;
import com.afsun.sqlanalyzer.core.ast.ColumnReference;
import com.afsun.sqlanalyzer.core.ast.DeleteStatement;
import com.afsun.sqlanalyzer.core.ast.Expression;
import com.afsun.sqlanalyzer.core.ast.ExpressionVisitor;
import com.afsun.sqlanalyzer.core.ast.FunctionCall;
import com.afsun.sqlanalyzer.core.ast.InsertStatement;
import com.afsun.sqlanalyzer.core.ast.JoinClause;
import com.afsun.sqlanalyzer.core.ast.Literal;
import com.afsun.sqlanalyzer.core.ast.OrderByClause;
import com.afsun.sqlanalyzer.core.ast.SelectStatement;
import com.afsun.sqlanalyzer.core.ast.SqlRenderer;
import com.afsun.sqlanalyzer.core.ast.StarExpression;
import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.ast.StatementType;
import com.afsun.sqlanalyzer.core.ast.StatementVisitor;
import com.afsun.sqlanalyzer.core.ast.TableReference;
import com.afsun.sqlanalyzer.core.ast.UpdateStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 默认查询分析器，结果只取决于语法树本身，实例无状态，可并发使用
 *
 * @author afsun
 */
public class DefaultQueryAnalyzer implements QueryAnalyzer, StatementVisitor<AnalysisResult> {

    public static final int DEFAULT_COMPLEX_JOIN_THRESHOLD = 3;

    private final int complexJoinThreshold;

    public DefaultQueryAnalyzer() {
        this(DEFAULT_COMPLEX_JOIN_THRESHOLD);
    }

    public DefaultQueryAnalyzer(int complexJoinThreshold) {
        this.complexJoinThreshold = complexJoinThreshold;
    }

    @Override
    public AnalysisResult analyze(Statement statement) {
        if (statement == null) {
            throw new IllegalArgumentException("statement 不能为空");
        }
        return statement.accept(this);
    }

    @Override
    public AnalysisResult visitSelect(SelectStatement stmt) {
        String usage = StatementType.SELECT.name();
        List<TableReference> fromTables = stmt.getFrom() == null
                ? Collections.emptyList() : stmt.getFrom().getTables();

        // 1. 表：先 FROM，后 JOIN
        List<TableInfo> tables = new ArrayList<>();
        for (TableReference t : fromTables) {
            tables.add(toTableInfo(t, usage));
        }
        for (JoinClause join : stmt.getJoins()) {
            tables.add(toTableInfo(join.getTable(), usage));
        }

        // 2. 列：按子句遍历表达式
        ExpressionWalker walker = new ExpressionWalker();
        walker.walkAll(stmt.getColumns(), ColumnUsage.SELECT);
        for (JoinClause join : stmt.getJoins()) {
            walker.walk(join.getCondition(), ColumnUsage.JOIN);
        }
        walker.walk(stmt.getWhere(), ColumnUsage.WHERE);
        walker.walkAll(stmt.getGroupBy(), ColumnUsage.GROUP_BY);
        walker.walk(stmt.getHaving(), ColumnUsage.HAVING);
        for (OrderByClause item : stmt.getOrderBy()) {
            walker.walk(item.getExpression(), ColumnUsage.ORDER_BY);
        }

        // 3. JOIN：推断左表
        List<JoinInfo> joins = new ArrayList<>();
        List<TableReference> visible = new ArrayList<>(fromTables);
        for (JoinClause join : stmt.getJoins()) {
            TableReference right = join.getTable();
            String left = inferLeftTable(join, visible);
            joins.add(new JoinInfo(join.getJoinType(), left, right.getName(), SqlRenderer.render(join.getCondition())));
            visible.add(right);
        }

        int complexity = computeComplexity(stmt, walker);
        List<Suggestion> suggestions = suggest(stmt, tables.size(), walker);
        return new AnalysisResult(StatementType.SELECT, tables, walker.columns, joins, complexity, suggestions);
    }

    @Override
    public AnalysisResult visitInsert(InsertStatement stmt) {
        return targetOnly(StatementType.INSERT, stmt.getTable());
    }

    @Override
    public AnalysisResult visitUpdate(UpdateStatement stmt) {
        return targetOnly(StatementType.UPDATE, stmt.getTable());
    }

    @Override
    public AnalysisResult visitDelete(DeleteStatement stmt) {
        return targetOnly(StatementType.DELETE, stmt.getTable());
    }

    private AnalysisResult targetOnly(StatementType type, TableReference target) {
        List<TableInfo> tables = target == null
                ? Collections.emptyList()
                : Collections.singletonList(toTableInfo(target, type.name()));
        return new AnalysisResult(type, tables, Collections.emptyList(), Collections.emptyList(),
                1, Collections.emptyList());
    }

    private static TableInfo toTableInfo(TableReference t, String usage) {
        return new TableInfo(t.getName(), t.getSchema(), t.getAlias(), usage);
    }

    /**
     * 左表推断：ON 条件中第一个指向已出现表（非右表）的限定符；
     * 否则取前一个 JOIN 的表，再否则取 FROM 中最后一张表
     */
    private static String inferLeftTable(JoinClause join, List<TableReference> visible) {
        TableReference right = join.getTable();
        List<ColumnReference> refs = new ArrayList<>();
        collectColumns(join.getCondition(), refs);
        for (ColumnReference ref : refs) {
            String qualifier = ref.getTable();
            if (qualifier == null || right.matches(qualifier)) {
                continue;
            }
            for (TableReference candidate : visible) {
                if (candidate.matches(qualifier)) {
                    return candidate.getName();
                }
            }
        }
        return visible.isEmpty() ? null : visible.get(visible.size() - 1).getName();
    }

    private static void collectColumns(Expression expr, List<ColumnReference> out) {
        if (expr instanceof ColumnReference) {
            out.add((ColumnReference) expr);
        } else if (expr instanceof BinaryExpression) {
            collectColumns(((BinaryExpression) expr).getLeft(), out);
            collectColumns(((BinaryExpression) expr).getRight(), out);
        } else if (expr instanceof FunctionCall) {
            for (Expression arg : ((FunctionCall) expr).getArguments()) {
                collectColumns(arg, out);
            }
        }
    }

    /**
     * 复杂度 = 1 + JOIN 表数 + WHERE 条件数 + GROUP BY 键数 + HAVING + 函数调用数
     */
    private static int computeComplexity(SelectStatement stmt, ExpressionWalker walker) {
        int score = 1;
        score += stmt.getJoins().size();
        if (stmt.getWhere() != null) {
            score += 1 + countLogicalOperators(stmt.getWhere());
        }
        score += stmt.getGroupBy().size();
        if (stmt.getHaving() != null) {
            score += 1;
        }
        score += walker.functionCalls;
        return score;
    }

    /**
     * 表达式平铺解析后 AND/OR 不一定在树根，按整棵树中的逻辑运算符计数
     */
    private static int countLogicalOperators(Expression expr) {
        if (!(expr instanceof BinaryExpression)) {
            return 0;
        }
        BinaryExpression b = (BinaryExpression) expr;
        int own = b.isLogical() ? 1 : 0;
        return own + countLogicalOperators(b.getLeft()) + countLogicalOperators(b.getRight());
    }

    private List<Suggestion> suggest(SelectStatement stmt, int tableCount, ExpressionWalker walker) {
        List<Suggestion> suggestions = new ArrayList<>();
        int joinCount = stmt.getJoins().size();
        if (joinCount > complexJoinThreshold) {
            suggestions.add(Suggestion.of(SuggestionType.COMPLEX_QUERY, Severity.INFO,
                    "查询包含 " + joinCount + " 个 JOIN，超过阈值 " + complexJoinThreshold
                            + "，建议拆分为多个简单查询或使用临时表"));
        }
        for (Expression column : stmt.getColumns()) {
            if (column instanceof StarExpression) {
                suggestions.add(Suggestion.of(SuggestionType.SELECT_STAR, Severity.WARNING,
                        "SELECT " + SqlRenderer.render(column) + " 会读取全部列，建议显式列出所需列"));
                break;
            }
        }
        if (tableCount > 1 && stmt.getWhere() == null) {
            suggestions.add(Suggestion.of(SuggestionType.MISSING_WHERE, Severity.WARNING,
                    "多表查询（" + tableCount + " 张表）没有 WHERE 条件，可能产生大量结果"));
        }
        for (String pattern : walker.leadingWildcards) {
            suggestions.add(Suggestion.of(SuggestionType.LEADING_WILDCARD, Severity.WARNING,
                    "LIKE '" + pattern + "' 以通配符开头，无法使用索引"));
        }
        for (String function : walker.functionsOnColumnsInWhere) {
            suggestions.add(Suggestion.of(SuggestionType.FUNCTION_ON_COLUMN, Severity.INFO,
                    "WHERE 中对列使用函数 " + function + "，可能导致索引失效"));
        }
        if (!stmt.getOrderBy().isEmpty() && stmt.getTop() == null) {
            suggestions.add(Suggestion.of(SuggestionType.ORDER_BY_WITHOUT_TOP, Severity.INFO,
                    "ORDER BY 未配合 TOP 使用，将对全部结果排序"));
        }
        return suggestions;
    }

    /**
     * 单次分析内使用的表达式遍历器，记录当前所在子句
     */
    private static final class ExpressionWalker implements ExpressionVisitor<Void> {

        private final List<ColumnInfo> columns = new ArrayList<>();
        private final List<String> leadingWildcards = new ArrayList<>();
        private final List<String> functionsOnColumnsInWhere = new ArrayList<>();
        private int functionCalls;
        private ColumnUsage usage;

        void walk(Expression expr, ColumnUsage clause) {
            if (expr == null) {
                return;
            }
            this.usage = clause;
            expr.accept(this);
        }

        void walkAll(List<Expression> exprs, ColumnUsage clause) {
            for (Expression expr : exprs) {
                walk(expr, clause);
            }
        }

        @Override
        public Void visitColumnReference(ColumnReference expr) {
            columns.add(new ColumnInfo(expr.getTable(), expr.getColumn(), usage));
            return null;
        }

        @Override
        public Void visitLiteral(Literal expr) {
            return null;
        }

        @Override
        public Void visitBinaryExpression(BinaryExpression expr) {
            if ("LIKE".equals(expr.getOperator()) && expr.getRight() instanceof Literal) {
                Literal pattern = (Literal) expr.getRight();
                if (pattern.isString() && ((String) pattern.getValue()).startsWith("%")) {
                    leadingWildcards.add((String) pattern.getValue());
                }
            }
            expr.getLeft().accept(this);
            expr.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitStarExpression(StarExpression expr) {
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall expr) {
            functionCalls++;
            if (usage == ColumnUsage.WHERE && referencesColumn(expr)) {
                functionsOnColumnsInWhere.add(expr.getName());
            }
            for (Expression arg : expr.getArguments()) {
                arg.accept(this);
            }
            return null;
        }

        private static boolean referencesColumn(FunctionCall call) {
            List<ColumnReference> refs = new ArrayList<>();
            collectColumns(call, refs);
            return !refs.isEmpty();
        }
    }
}
