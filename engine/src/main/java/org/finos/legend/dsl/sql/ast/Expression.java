package org.finos.legend.dsl.sql.ast;

import java.util.List;
import java.util.Objects;

/**
 * Represents an SQL expression.
 *
 * Expressions can be used in SELECT, WHERE, HAVING, ON, and other clauses.
 */
public sealed interface Expression extends SQLNode
        permits Expression.ColumnRef, Expression.Literal, Expression.ArrayExpr, Expression.Star,
        Expression.BinaryOp, Expression.UnaryOp, Expression.FunctionCall, Expression.IsNullExpr,
        Expression.CastExpr, Expression.WindowExpr, Expression.Labeled {

    // ==================== Factory Methods ====================

    static Expression.ColumnRef column(String name) {
        return new ColumnRef(null, name);
    }

    static Expression.Literal stringLiteral(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    static Expression.Literal boolLiteral(boolean value) {
        return new Literal(LiteralType.BOOLEAN, value);
    }

    // ==================== AST Node Types ====================

    /**
     * Column reference: table.column or just column
     */
    record ColumnRef(String tableAlias, String columnName) implements Expression {
        public ColumnRef {
            Objects.requireNonNull(columnName, "Column name cannot be null");
        }

        public boolean isQualified() {
            return tableAlias != null;
        }

        public ColumnRef qualified(String table) {
            return new ColumnRef(table, columnName);
        }
    }

    /**
     * Literal value: 'string', 123, 45.67, TRUE, DATE '2024-01-15', NULL
     */
    record Literal(LiteralType type, Object value) implements Expression {
    }

    enum LiteralType {
        STRING, INTEGER, DECIMAL, BOOLEAN, DATE, TIMESTAMP, NULL
    }

    /**
     * Array constructor: ARRAY[e1, e2, ...]
     */
    record ArrayExpr(List<Expression> elements) implements Expression {
        public ArrayExpr {
            elements = List.copyOf(elements);
        }
    }

    /**
     * All rows marker inside count(*)
     */
    record Star() implements Expression {
    }

    /**
     * Binary operation: left op right
     * e.g., a = 1, x + y, p AND q
     */
    record BinaryOp(Expression left, BinaryOperator operator, Expression right) implements Expression {
    }

    enum BinaryOperator {
        // Comparison
        EQ("=", 4), NE("<>", 4), LT("<", 4), LE("<=", 4), GT(">", 4), GE(">=", 4),

        // Logical
        AND("AND", 2), OR("OR", 1),

        // Arithmetic
        PLUS("+", 5), MINUS("-", 5), MULTIPLY("*", 6), DIVIDE("/", 6), MODULO("%", 6);

        private final String sql;
        private final int precedence;

        BinaryOperator(String sql, int precedence) {
            this.sql = sql;
            this.precedence = precedence;
        }

        public String toSql() {
            return sql;
        }

        /**
         * @return Binding strength (higher binds tighter)
         */
        public int precedence() {
            return precedence;
        }
    }

    /**
     * Unary operation: op expr
     * e.g., NOT condition
     */
    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
    }

    enum UnaryOperator {
        NOT("NOT");

        private final String sql;

        UnaryOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }
    }

    /**
     * Function call: functionName(arg1, arg2, ...)
     * e.g., abs(x), count(*), sum(salary)
     */
    record FunctionCall(String functionName, List<Expression> arguments) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * expr IS NULL or expr IS NOT NULL
     */
    record IsNullExpr(Expression expr, boolean negated) implements Expression {
    }

    /**
     * CAST(expr AS type)
     */
    record CastExpr(Expression expr, String targetType) implements Expression {
    }

    /**
     * Window function: func() OVER (PARTITION BY ... ORDER BY ... frame)
     */
    record WindowExpr(
            FunctionCall function,
            List<Expression> partitionBy,
            List<OrderSpec> orderBy,
            FrameSpec frame) implements Expression {

        public boolean hasPartition() {
            return partitionBy != null && !partitionBy.isEmpty();
        }

        public boolean hasOrderBy() {
            return orderBy != null && !orderBy.isEmpty();
        }

        public boolean hasFrame() {
            return frame != null;
        }
    }

    /**
     * Window frame specification: ROWS/GROUPS/RANGE BETWEEN start AND end
     */
    record FrameSpec(FrameType type, FrameBound start, FrameBound end) {
    }

    enum FrameType {
        ROWS, GROUPS, RANGE
    }

    record FrameBound(FrameBoundType type, Integer offset) {
        public static FrameBound unboundedPreceding() {
            return new FrameBound(FrameBoundType.UNBOUNDED_PRECEDING, null);
        }

        public static FrameBound unboundedFollowing() {
            return new FrameBound(FrameBoundType.UNBOUNDED_FOLLOWING, null);
        }

        public static FrameBound currentRow() {
            return new FrameBound(FrameBoundType.CURRENT_ROW, null);
        }

        public static FrameBound preceding(int offset) {
            return new FrameBound(FrameBoundType.PRECEDING, offset);
        }

        public static FrameBound following(int offset) {
            return new FrameBound(FrameBoundType.FOLLOWING, offset);
        }
    }

    enum FrameBoundType {
        UNBOUNDED_PRECEDING, UNBOUNDED_FOLLOWING, CURRENT_ROW, PRECEDING, FOLLOWING
    }

    /**
     * Expression carrying its output label, which becomes the select item alias.
     */
    record Labeled(Expression expression, String label) implements Expression {
        public Labeled {
            Objects.requireNonNull(expression, "Labeled expression cannot be null");
            Objects.requireNonNull(label, "Label cannot be null");
        }
    }
}
