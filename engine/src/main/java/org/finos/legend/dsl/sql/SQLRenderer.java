package org.finos.legend.dsl.sql;

import org.finos.legend.dsl.sql.ast.Expression;
import org.finos.legend.dsl.sql.ast.FromItem;
import org.finos.legend.dsl.sql.ast.OrderSpec;
import org.finos.legend.dsl.sql.ast.QueryStatement;
import org.finos.legend.dsl.sql.ast.SelectItem;
import org.finos.legend.dsl.sql.ast.SelectStatement;
import org.finos.legend.dsl.sql.ast.SetStatement;
import org.finos.legend.dsl.transpiler.SQLDialect;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a SQL AST into dialect-specific SQL text.
 *
 * Operands are parenthesized only where the operator precedence requires it.
 */
public final class SQLRenderer {

    private static final int UNARY_PRECEDENCE = 3;
    private static final int PREDICATE_PRECEDENCE = 4;
    private static final int ATOM_PRECEDENCE = 10;

    private final SQLDialect dialect;

    public SQLRenderer(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * Renders a complete statement.
     */
    public String render(QueryStatement statement) {
        if (statement instanceof SelectStatement select) {
            return renderSelect(select);
        }
        SetStatement set = (SetStatement) statement;
        return render(set.left()) + " " + set.operator().toSql() + " " + render(set.right());
    }

    // ==================== Statements ====================

    private String renderSelect(SelectStatement select) {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(select.selectItems().stream().map(this::renderSelectItem).collect(Collectors.joining(", ")));
        sql.append(" FROM ").append(renderFrom(select.from()));
        if (select.hasWhere()) {
            sql.append(" WHERE ").append(renderExpression(select.where()));
        }
        if (select.hasGroupBy()) {
            sql.append(" GROUP BY ").append(renderList(select.groupBy()));
        }
        if (select.hasHaving()) {
            sql.append(" HAVING ").append(renderExpression(select.having()));
        }
        if (select.hasOrderBy()) {
            sql.append(" ORDER BY ").append(renderOrderBy(select.orderBy()));
        }
        if (select.hasLimit()) {
            sql.append(' ').append(dialect.formatLimit(select.limit(),
                    select.offset() != null ? select.offset() : 0));
        }
        return sql.toString();
    }

    private String renderSelectItem(SelectItem item) {
        if (item instanceof SelectItem.AllColumns all) {
            return all.isQualified() ? dialect.quoteIdentifier(all.tableQualifier()) + ".*" : "*";
        }
        SelectItem.ExpressionItem expression = (SelectItem.ExpressionItem) item;
        String sql = renderExpression(expression.expression());
        return expression.hasAlias() ? sql + " AS " + dialect.quoteIdentifier(expression.alias()) : sql;
    }

    private String renderFrom(FromItem item) {
        if (item instanceof FromItem.TableRef table) {
            String sql = table.hasSchema()
                    ? dialect.quoteIdentifier(table.schema()) + "." + dialect.quoteIdentifier(table.table())
                    : dialect.quoteIdentifier(table.table());
            return table.hasAlias() ? sql + " AS " + dialect.quoteIdentifier(table.alias()) : sql;
        }
        if (item instanceof FromItem.SubQuery subquery) {
            return "(" + render(subquery.query()) + ") AS " + dialect.quoteIdentifier(subquery.alias());
        }
        FromItem.JoinedTable join = (FromItem.JoinedTable) item;
        String right = join.right() instanceof FromItem.JoinedTable
                ? "(" + renderFrom(join.right()) + ")"
                : renderFrom(join.right());
        String sql = renderFrom(join.left()) + " " + join.joinType().toSql() + " " + right;
        if (join.condition() != null) {
            sql += " ON " + renderExpression(join.condition());
        }
        return sql;
    }

    private String renderOrderBy(List<OrderSpec> specs) {
        return specs.stream()
                .map(s -> renderExpression(s.expression()) + " " + s.direction().name())
                .collect(Collectors.joining(", "));
    }

    private String renderList(List<Expression> expressions) {
        return expressions.stream().map(this::renderExpression).collect(Collectors.joining(", "));
    }

    // ==================== Expressions ====================

    /**
     * Renders a standalone expression.
     */
    public String renderExpression(Expression expression) {
        if (expression instanceof Expression.ColumnRef column) {
            String name = dialect.quoteIdentifier(column.columnName());
            return column.isQualified() ? dialect.quoteIdentifier(column.tableAlias()) + "." + name : name;
        }
        if (expression instanceof Expression.Literal literal) {
            return renderLiteral(literal);
        }
        if (expression instanceof Expression.ArrayExpr array) {
            return "ARRAY[" + renderList(array.elements()) + "]";
        }
        if (expression instanceof Expression.Star) {
            return "*";
        }
        if (expression instanceof Expression.BinaryOp binary) {
            int precedence = binary.operator().precedence();
            return operand(binary.left(), precedence, false) + " " + binary.operator().toSql() + " "
                    + operand(binary.right(), precedence, true);
        }
        if (expression instanceof Expression.UnaryOp unary) {
            return unary.operator().toSql() + " " + operand(unary.operand(), UNARY_PRECEDENCE, false);
        }
        if (expression instanceof Expression.FunctionCall function) {
            return function.functionName() + "(" + renderList(function.arguments()) + ")";
        }
        if (expression instanceof Expression.IsNullExpr isNull) {
            return operand(isNull.expr(), PREDICATE_PRECEDENCE, true)
                    + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (expression instanceof Expression.CastExpr cast) {
            return "CAST(" + renderExpression(cast.expr()) + " AS " + cast.targetType() + ")";
        }
        if (expression instanceof Expression.WindowExpr window) {
            return renderWindow(window);
        }
        Expression.Labeled labeled = (Expression.Labeled) expression;
        return renderExpression(labeled.expression()) + " AS " + dialect.quoteIdentifier(labeled.label());
    }

    private String operand(Expression operand, int parent, boolean right) {
        String sql = renderExpression(operand);
        int precedence = precedence(operand);
        boolean wrap = right ? precedence <= parent : precedence < parent;
        return wrap ? "(" + sql + ")" : sql;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof Expression.BinaryOp binary) {
            return binary.operator().precedence();
        }
        if (expression instanceof Expression.UnaryOp) {
            return UNARY_PRECEDENCE;
        }
        if (expression instanceof Expression.IsNullExpr) {
            return PREDICATE_PRECEDENCE;
        }
        return ATOM_PRECEDENCE;
    }

    private String renderLiteral(Expression.Literal literal) {
        if (literal.value() == null) {
            return dialect.formatNull();
        }
        return switch (literal.type()) {
            case STRING -> dialect.quoteStringLiteral(literal.value().toString());
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DECIMAL -> literal.value() instanceof BigDecimal decimal
                    ? decimal.toPlainString()
                    : String.valueOf(literal.value());
            case DATE -> literal.value() instanceof LocalDateTime timestamp
                    ? dialect.formatDate(timestamp.toLocalDate())
                    : dialect.formatDate((LocalDate) literal.value());
            case TIMESTAMP -> dialect.formatTimestamp((LocalDateTime) literal.value());
            case NULL -> dialect.formatNull();
        };
    }

    private String renderWindow(Expression.WindowExpr window) {
        List<String> clauses = new ArrayList<>();
        if (window.hasPartition()) {
            clauses.add("PARTITION BY " + renderList(window.partitionBy()));
        }
        if (window.hasOrderBy()) {
            clauses.add("ORDER BY " + renderOrderBy(window.orderBy()));
        }
        if (window.hasFrame()) {
            Expression.FrameSpec frame = window.frame();
            clauses.add(frame.type() + " BETWEEN " + renderBound(frame.start()) + " AND " + renderBound(frame.end()));
        }
        return renderExpression(window.function()) + " OVER (" + String.join(" ", clauses) + ")";
    }

    private static String renderBound(Expression.FrameBound bound) {
        return switch (bound.type()) {
            case UNBOUNDED_PRECEDING -> "UNBOUNDED PRECEDING";
            case UNBOUNDED_FOLLOWING -> "UNBOUNDED FOLLOWING";
            case CURRENT_ROW -> "CURRENT ROW";
            case PRECEDING -> bound.offset() + " PRECEDING";
            case FOLLOWING -> bound.offset() + " FOLLOWING";
        };
    }
}
