package com.afsun.sqlanalyzer.core.ast;

import com.afsun.sqlanalyzer.core.lexer.Tokenizer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 将语法树还原为规范化 SQL 文本
 * 关键字大写、单空格分隔；右操作数为二元表达式时加括号，保证重新解析后分组不变。
 * 输出同时用作缓存指纹的输入，因此不同的树必须渲染出不同的文本：
 * 非普通标识符的名称一律加方括号，[a.b] 与 a.b 不会混淆。
 *
 * @author afsun
 */
public final class SqlRenderer implements ExpressionVisitor<String>, StatementVisitor<String> {

    private static final SqlRenderer INSTANCE = new SqlRenderer();

    /**
     * 词法上是 IDENT，但解析器按文本识别的词
     */
    private static final Set<String> CONTEXTUAL_WORDS = new HashSet<>(Arrays.asList("ASC", "DESC", "PERCENT", "OUTER"));

    private SqlRenderer() {
    }

    public static String render(Statement statement) {
        return statement.accept(INSTANCE);
    }

    public static String render(Expression expression) {
        return expression == null ? "" : expression.accept(INSTANCE);
    }

    /**
     * schema.name AS alias
     */
    public static String render(TableReference table) {
        StringBuilder sb = new StringBuilder();
        if (table.getSchema() != null) {
            sb.append(quote(table.getSchema())).append('.');
        }
        sb.append(quote(table.getName()));
        if (table.getAlias() != null) {
            sb.append(" AS ").append(quote(table.getAlias()));
        }
        return sb.toString();
    }

    @Override
    public String visitSelect(SelectStatement stmt) {
        StringBuilder sb = new StringBuilder("SELECT");
        if (stmt.isDistinct()) {
            sb.append(" DISTINCT");
        }
        if (stmt.getTop() != null) {
            sb.append(" TOP ").append(stmt.getTop().getCount());
            if (stmt.getTop().isPercent()) {
                sb.append(" PERCENT");
            }
        }
        sb.append(' ').append(join(stmt.getColumns(), SqlRenderer::render));
        if (stmt.getFrom() != null) {
            sb.append(" FROM ").append(join(stmt.getFrom().getTables(), SqlRenderer::render));
        }
        for (JoinClause join : stmt.getJoins()) {
            sb.append(' ').append(join.getJoinType().name()).append(" JOIN ")
                    .append(render(join.getTable()))
                    .append(" ON ").append(render(join.getCondition()));
        }
        if (stmt.getWhere() != null) {
            sb.append(" WHERE ").append(render(stmt.getWhere()));
        }
        if (!stmt.getGroupBy().isEmpty()) {
            sb.append(" GROUP BY ").append(join(stmt.getGroupBy(), SqlRenderer::render));
        }
        if (stmt.getHaving() != null) {
            sb.append(" HAVING ").append(render(stmt.getHaving()));
        }
        if (!stmt.getOrderBy().isEmpty()) {
            sb.append(" ORDER BY ").append(join(stmt.getOrderBy(),
                    o -> render(o.getExpression()) + " " + o.getDirection().name()));
        }
        return sb.toString();
    }

    @Override
    public String visitInsert(InsertStatement stmt) {
        return "INSERT" + target(stmt.getTable());
    }

    @Override
    public String visitUpdate(UpdateStatement stmt) {
        return "UPDATE" + target(stmt.getTable());
    }

    @Override
    public String visitDelete(DeleteStatement stmt) {
        return "DELETE" + target(stmt.getTable());
    }

    @Override
    public String visitColumnReference(ColumnReference expr) {
        String column = quote(expr.getColumn());
        return expr.getTable() == null ? column : quote(expr.getTable()) + "." + column;
    }

    @Override
    public String visitLiteral(Literal expr) {
        if (expr.isString()) {
            return "'" + expr.getValue() + "'";
        }
        return String.valueOf(expr.getValue());
    }

    @Override
    public String visitBinaryExpression(BinaryExpression expr) {
        String right = expr.getRight().accept(this);
        if (expr.getRight() instanceof BinaryExpression) {
            right = "(" + right + ")";
        }
        return expr.getLeft().accept(this) + " " + expr.getOperator() + " " + right;
    }

    @Override
    public String visitStarExpression(StarExpression expr) {
        return expr.getTable() == null ? "*" : quote(expr.getTable()) + ".*";
    }

    @Override
    public String visitFunctionCall(FunctionCall expr) {
        return quote(expr.getName()) + "(" + join(expr.getArguments(), SqlRenderer::render) + ")";
    }

    /**
     * 普通标识符原样输出，其余加方括号，内部的 ] 写成 ]]
     */
    static String quote(String name) {
        if (Tokenizer.isPlainIdentifier(name) && !CONTEXTUAL_WORDS.contains(name.toUpperCase(Locale.ROOT))) {
            return name;
        }
        return "[" + name.replace("]", "]]") + "]";
    }

    private static String target(TableReference table) {
        return table == null ? "" : " " + render(table);
    }

    private static <T> String join(List<T> items, Function<T, String> renderer) {
        return items.stream().map(renderer).collect(Collectors.joining(", "));
    }
}
