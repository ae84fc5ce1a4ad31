package com.afsun.sqlanalyzer.core.parser;

import com.afsun.sqlanalyzer.core.ast.BinaryExpression;
import com.afsun.sqlanalyzer.core.ast.ColumnReference;
import com.afsun.sqlanalyzer.core.ast.Expression;
import com.afsun.sqlanalyzer.core.ast.ExpressionVisitor;
import com.afsun.sqlanalyzer.core.ast.FunctionCall;
import com.afsun.sqlanalyzer.core.ast.JoinClause;
import com.afsun.sqlanalyzer.core.ast.Literal;
import com.afsun.sqlanalyzer.core.ast.OrderByClause;
import com.afsun.sqlanalyzer.core.ast.Reusable;
import com.afsun.sqlanalyzer.core.ast.SelectStatement;
import com.afsun.sqlanalyzer.core.ast.StarExpression;
import com.afsun.sqlanalyzer.core.ast.Statement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * 高频语法树节点的对象池：SelectStatement、JoinClause、BinaryExpression、ColumnReference
 * 非线程安全，每个 ParseContext 独占一个。
 * 归还时机：调用方不再持有整棵树时调用 {@link #release(Statement)}，
 * 或解析出错时由解析器归还未完成的节点。
 *
 * @author afsun
 */
public class NodePool {

    public static final int DEFAULT_MAX_FREE_PER_SHAPE = 256;

    private final FreeList<SelectStatement> selects;
    private final FreeList<JoinClause> joins;
    private final FreeList<BinaryExpression> binaries;
    private final FreeList<ColumnReference> columns;

    private final ExpressionVisitor<Void> releaser = new ExpressionReleaser();

    public NodePool() {
        this(DEFAULT_MAX_FREE_PER_SHAPE);
    }

    public NodePool(int maxFreePerShape) {
        if (maxFreePerShape < 0) {
            throw new IllegalArgumentException("maxFreePerShape 不能为负数: " + maxFreePerShape);
        }
        this.selects = new FreeList<>(SelectStatement::new, maxFreePerShape);
        this.joins = new FreeList<>(JoinClause::new, maxFreePerShape);
        this.binaries = new FreeList<>(BinaryExpression::new, maxFreePerShape);
        this.columns = new FreeList<>(ColumnReference::new, maxFreePerShape);
    }

    public SelectStatement acquireSelect() {
        return selects.acquire();
    }

    public JoinClause acquireJoin() {
        return joins.acquire();
    }

    public BinaryExpression acquireBinary() {
        return binaries.acquire();
    }

    public ColumnReference acquireColumn() {
        return columns.acquire();
    }

    /**
     * 归还整棵语句树，归还后调用方不得再访问该树
     */
    public void release(Statement statement) {
        if (statement instanceof SelectStatement) {
            release((SelectStatement) statement);
        }
    }

    public void release(SelectStatement stmt) {
        if (stmt == null) {
            return;
        }
        stmt.getColumns().forEach(this::release);
        stmt.getJoins().forEach(this::release);
        release(stmt.getWhere());
        stmt.getGroupBy().forEach(this::release);
        release(stmt.getHaving());
        for (OrderByClause item : stmt.getOrderBy()) {
            release(item.getExpression());
        }
        selects.offer(stmt);
    }

    public void release(JoinClause join) {
        if (join == null) {
            return;
        }
        release(join.getCondition());
        joins.offer(join);
    }

    public void release(Expression expression) {
        if (expression != null) {
            expression.accept(releaser);
        }
    }

    public long getCreatedCount() {
        return selects.created + joins.created + binaries.created + columns.created;
    }

    public long getReusedCount() {
        return selects.reused + joins.reused + binaries.reused + columns.reused;
    }

    public int getFreeCount() {
        return selects.free.size() + joins.free.size() + binaries.free.size() + columns.free.size();
    }

    private class ExpressionReleaser implements ExpressionVisitor<Void> {

        @Override
        public Void visitColumnReference(ColumnReference expr) {
            columns.offer(expr);
            return null;
        }

        @Override
        public Void visitLiteral(Literal expr) {
            return null;
        }

        @Override
        public Void visitBinaryExpression(BinaryExpression expr) {
            release(expr.getLeft());
            release(expr.getRight());
            binaries.offer(expr);
            return null;
        }

        @Override
        public Void visitStarExpression(StarExpression expr) {
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall expr) {
            expr.getArguments().forEach(NodePool.this::release);
            return null;
        }
    }

    private static final class FreeList<T extends Reusable> {
        private final Deque<T> free = new ArrayDeque<>();
        private final Supplier<T> factory;
        private final int maxFree;
        private long created;
        private long reused;

        private FreeList(Supplier<T> factory, int maxFree) {
            this.factory = factory;
            this.maxFree = maxFree;
        }

        private T acquire() {
            T node = free.pollFirst();
            if (node == null) {
                created++;
                return factory.get();
            }
            reused++;
            return node;
        }

        private void offer(T node) {
            node.reset();
            if (free.size() < maxFree) {
                free.offerFirst(node);
            }
        }
    }
}
