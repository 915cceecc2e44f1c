package org.finos.legend.dsl.sql;

import org.finos.legend.dsl.UnsupportedException;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.Arithmetic;
import org.finos.legend.dsl.feature.Cast;
import org.finos.legend.dsl.feature.Comparison;
import org.finos.legend.dsl.feature.DateFunction;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Logical;
import org.finos.legend.dsl.feature.MathFunction;
import org.finos.legend.dsl.feature.Ordering;
import org.finos.legend.dsl.feature.Window;
import org.finos.legend.dsl.frame.Join;
import org.finos.legend.dsl.frame.Rows;
import org.finos.legend.dsl.frame.SetOperation;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.kind.Kind;
import org.finos.legend.dsl.parser.Visitor;
import org.finos.legend.dsl.sql.ast.Expression;
import org.finos.legend.dsl.sql.ast.FromItem;
import org.finos.legend.dsl.sql.ast.OrderSpec;
import org.finos.legend.dsl.sql.ast.QueryStatement;
import org.finos.legend.dsl.sql.ast.SQLNode;
import org.finos.legend.dsl.sql.ast.SelectItem;
import org.finos.legend.dsl.sql.ast.SelectStatement;
import org.finos.legend.dsl.sql.ast.SetStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Compiles a frame source into a typed SQL AST.
 *
 * Sources are mapped to {@link FromItem.TableRef}s (or any other SQL node) and
 * features to SQL expressions; elements without an explicit mapping fall back
 * to an unqualified column of their name. Anonymous sub-queries get generated
 * {@code anon_<n>} aliases.
 */
public final class SQLTreeGenerator extends Visitor<SQLNode, Expression> {

    private int anonymous;

    public SQLTreeGenerator(Map<? extends Source, ? extends SQLNode> sources,
                            Map<? extends Feature, ? extends Expression> features) {
        super(sources, features);
    }

    /**
     * Compiles the source into a statement.
     */
    public QueryStatement generate(Source source) {
        return statement(parse(source));
    }

    @Override
    public Optional<Expression> resolveFeature(Feature feature) {
        Optional<Expression> resolved = super.resolveFeature(feature);
        if (resolved.isEmpty() && feature instanceof Element) {
            return Optional.of(Expression.column(feature.name()));
        }
        return resolved;
    }

    // ==================== Features ====================

    @Override
    protected Expression generateElement(SQLNode origin, Expression element) {
        if (element instanceof Expression.ColumnRef column) {
            return column.qualified(qualifier(origin));
        }
        return element;
    }

    private static String qualifier(SQLNode origin) {
        if (origin instanceof FromItem.TableRef table) {
            return table.effectiveName();
        }
        if (origin instanceof FromItem.SubQuery subquery) {
            return subquery.alias();
        }
        return null;
    }

    @Override
    protected Expression generateAlias(Expression feature, String alias) {
        return new Expression.Labeled(feature, alias);
    }

    @Override
    protected Expression generateLiteral(Object value, Kind kind) {
        if (kind instanceof Kind.Primitive primitive) {
            return switch (primitive) {
                case STRING -> Expression.stringLiteral(value.toString());
                case BOOLEAN -> Expression.boolLiteral((Boolean) value);
                case INTEGER -> new Expression.Literal(Expression.LiteralType.INTEGER, value);
                case FLOAT, DECIMAL -> new Expression.Literal(Expression.LiteralType.DECIMAL, value);
                case DATE -> new Expression.Literal(Expression.LiteralType.DATE, value);
                case TIMESTAMP -> new Expression.Literal(Expression.LiteralType.TIMESTAMP, value);
            };
        }
        if (kind instanceof Kind.Array array && value instanceof List<?> values) {
            return new Expression.ArrayExpr(values.stream()
                    .map(v -> generateLiteral(v, array.element()))
                    .collect(Collectors.toList()));
        }
        throw new UnsupportedException("Unsupported literal kind: " + kind);
    }

    @Override
    protected Expression generateExpression(org.finos.legend.dsl.feature.Expression expression,
                                            List<Expression> arguments) {
        if (expression instanceof Comparison comparison) {
            Expression left = arguments.get(0);
            return switch (comparison.operator()) {
                case LESS_THAN -> binary(left, Expression.BinaryOperator.LT, arguments);
                case LESS_EQUAL -> binary(left, Expression.BinaryOperator.LE, arguments);
                case GREATER_THAN -> binary(left, Expression.BinaryOperator.GT, arguments);
                case GREATER_EQUAL -> binary(left, Expression.BinaryOperator.GE, arguments);
                case EQUAL -> binary(left, Expression.BinaryOperator.EQ, arguments);
                case NOT_EQUAL -> binary(left, Expression.BinaryOperator.NE, arguments);
                case IS_NULL -> new Expression.IsNullExpr(left, false);
                case NOT_NULL -> new Expression.IsNullExpr(left, true);
            };
        }
        if (expression instanceof Logical logical) {
            Expression left = arguments.get(0);
            return switch (logical.operator()) {
                case AND -> binary(left, Expression.BinaryOperator.AND, arguments);
                case OR -> binary(left, Expression.BinaryOperator.OR, arguments);
                case NOT -> new Expression.UnaryOp(Expression.UnaryOperator.NOT, left);
            };
        }
        if (expression instanceof Arithmetic arithmetic) {
            Expression.BinaryOperator operator = switch (arithmetic.operator()) {
                case ADDITION -> Expression.BinaryOperator.PLUS;
                case SUBTRACTION -> Expression.BinaryOperator.MINUS;
                case MULTIPLICATION -> Expression.BinaryOperator.MULTIPLY;
                case DIVISION -> Expression.BinaryOperator.DIVIDE;
                case MODULUS -> Expression.BinaryOperator.MODULO;
            };
            return binary(arguments.get(0), operator, arguments);
        }
        if (expression instanceof Cast cast) {
            return new Expression.CastExpr(arguments.get(0), typeName(cast.kind()));
        }
        if (expression instanceof Aggregate aggregate) {
            return aggregate(aggregate, arguments);
        }
        if (expression instanceof MathFunction math) {
            return new Expression.FunctionCall(math.function().name().toLowerCase(), arguments);
        }
        if (expression instanceof DateFunction date) {
            return new Expression.FunctionCall(date.function().name().toLowerCase(), arguments);
        }
        throw new UnsupportedException("Unsupported expression: " + expression);
    }

    private static Expression binary(Expression left, Expression.BinaryOperator operator, List<Expression> arguments) {
        return new Expression.BinaryOp(left, operator, arguments.get(1));
    }

    private static Expression.FunctionCall aggregate(Aggregate aggregate, List<Expression> arguments) {
        List<Expression> operands = arguments.isEmpty() ? List.of(new Expression.Star()) : arguments;
        return new Expression.FunctionCall(aggregate.function().name().toLowerCase(), operands);
    }

    private static String typeName(Kind kind) {
        if (!(kind instanceof Kind.Primitive primitive)) {
            throw new UnsupportedException("Unsupported cast kind: " + kind);
        }
        return switch (primitive) {
            case BOOLEAN -> "BOOLEAN";
            case INTEGER -> "INTEGER";
            case FLOAT -> "DOUBLE";
            case DECIMAL -> "DECIMAL";
            case STRING -> "VARCHAR";
            case DATE -> "DATE";
            case TIMESTAMP -> "TIMESTAMP";
        };
    }

    @Override
    protected Expression generateWindow(Window window, List<Expression> arguments, List<Expression> partition,
                                        List<OrderTerm<Expression>> ordering) {
        if (!(window.function() instanceof Aggregate aggregate)) {
            throw new UnsupportedException("Unsupported window function: " + window.function());
        }
        Expression.FrameSpec frame = null;
        if (window.frame() != null) {
            frame = new Expression.FrameSpec(
                    Expression.FrameType.valueOf(window.frame().mode().name()),
                    frameBound(window.frame().start(), Expression.FrameBound.unboundedPreceding()),
                    frameBound(window.frame().end(), Expression.FrameBound.unboundedFollowing()));
        }
        return new Expression.WindowExpr(aggregate(aggregate, arguments), partition, orderBy(ordering), frame);
    }

    private static Expression.FrameBound frameBound(Integer offset, Expression.FrameBound unbounded) {
        if (offset == null) {
            return unbounded;
        }
        if (offset == 0) {
            return Expression.FrameBound.currentRow();
        }
        return offset < 0 ? Expression.FrameBound.preceding(-offset) : Expression.FrameBound.following(offset);
    }

    private static List<OrderSpec> orderBy(List<OrderTerm<Expression>> terms) {
        return terms.stream()
                .map(t -> t.direction() == Ordering.Direction.ASCENDING
                        ? OrderSpec.asc(t.feature())
                        : OrderSpec.desc(t.feature()))
                .collect(Collectors.toList());
    }

    // ==================== Sources ====================

    @Override
    protected Referenced<SQLNode> generateReference(SQLNode instance, String name) {
        FromItem origin;
        if (instance instanceof FromItem.TableRef table) {
            origin = table.as(name);
        } else if (instance instanceof FromItem.SubQuery subquery) {
            origin = new FromItem.SubQuery(subquery.query(), name);
        } else {
            origin = new FromItem.SubQuery(statement(instance), name);
        }
        return new Referenced<>(origin, FromItem.TableRef.of(name));
    }

    /**
     * RIGHT joins are emitted as LEFT joins with swapped sides.
     */
    @Override
    protected SQLNode generateJoin(SQLNode left, SQLNode right, Expression condition, Join.Kind kind) {
        return switch (kind) {
            case INNER -> new FromItem.JoinedTable(from(left), FromItem.JoinedTable.JoinType.INNER, from(right),
                    condition);
            case LEFT -> new FromItem.JoinedTable(from(left), FromItem.JoinedTable.JoinType.LEFT_OUTER, from(right),
                    condition);
            case RIGHT -> new FromItem.JoinedTable(from(right), FromItem.JoinedTable.JoinType.LEFT_OUTER, from(left),
                    condition);
            case FULL -> new FromItem.JoinedTable(from(left), FromItem.JoinedTable.JoinType.FULL_OUTER, from(right),
                    condition);
            case CROSS -> new FromItem.JoinedTable(from(left), FromItem.JoinedTable.JoinType.CROSS, from(right),
                    null);
        };
    }

    @Override
    protected SQLNode generateSet(SQLNode left, SQLNode right, SetOperation.Kind kind) {
        SetStatement.SetOperator operator = switch (kind) {
            case UNION -> SetStatement.SetOperator.UNION;
            case INTERSECTION -> SetStatement.SetOperator.INTERSECT;
            case DIFFERENCE -> SetStatement.SetOperator.EXCEPT;
        };
        return new SetStatement(statement(left), operator, statement(right));
    }

    @Override
    protected SQLNode generateQuery(SQLNode source, List<Expression> features, Expression where,
                                    List<Expression> groupby, Expression having,
                                    List<OrderTerm<Expression>> orderby, Rows rows) {
        List<SelectItem> items = new ArrayList<>(features.size());
        for (Expression feature : features) {
            if (feature instanceof Expression.Labeled labeled) {
                items.add(SelectItem.ExpressionItem.of(labeled.expression(), labeled.label()));
            } else {
                items.add(SelectItem.ExpressionItem.of(feature));
            }
        }
        return new SelectStatement(items, from(source), where, groupby, having, orderBy(orderby),
                rows != null ? rows.count() : null,
                rows != null && rows.offset() > 0 ? rows.offset() : null);
    }

    // ==================== Helpers ====================

    private FromItem from(SQLNode source) {
        if (source instanceof FromItem item) {
            return item;
        }
        return new FromItem.SubQuery(statement(source), "anon_" + ++anonymous);
    }

    private static QueryStatement statement(SQLNode source) {
        if (source instanceof QueryStatement statement) {
            return statement;
        }
        if (source instanceof FromItem item) {
            return SelectStatement.all(item);
        }
        throw new UnsupportedException("Not a source: " + source);
    }
}
