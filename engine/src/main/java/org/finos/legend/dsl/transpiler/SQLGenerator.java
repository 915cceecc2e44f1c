package org.finos.legend.dsl.transpiler;

import org.finos.legend.dsl.UnsupportedException;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.Arithmetic;
import org.finos.legend.dsl.feature.Cast;
import org.finos.legend.dsl.feature.Comparison;
import org.finos.legend.dsl.feature.DateFunction;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Expression;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles a frame source into SQL text.
 *
 * Sources and features are addressed by the plain names supplied in the
 * mappings; elements without an explicit mapping fall back to their field name.
 * All identifiers are quoted through the {@link SQLDialect}.
 *
 * A generator instance is meant for a single {@link #parse(Source)} call.
 */
public final class SQLGenerator extends Visitor<String, String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SQLGenerator.class);

    /**
     * Operands not needing parentheses apart from function calls: single words and date/time literals.
     */
    private static final Pattern ASSOCIATIVE = Pattern.compile(
            "\\s*(?:[^-+*/%\\s]+|TIMESTAMP *'[^']*'|DATE *'[^']*')\\s*");

    private static final Pattern WORD = Pattern.compile("\\s*\\S+\\s*");

    private static final Pattern QUERY = Pattern.compile("\\s*SELECT");

    private final SQLDialect dialect;

    public SQLGenerator(Map<? extends Source, String> sources, Map<? extends Feature, String> features) {
        this(sources, features, AnsiDialect.INSTANCE);
    }

    public SQLGenerator(Map<? extends Source, String> sources, Map<? extends Feature, String> features,
                        SQLDialect dialect) {
        super(sources, features);
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    @Override
    public String parse(Source source) {
        String sql = super.parse(source);
        LOGGER.debug("Generated {} SQL for {}:\n{}", dialect.name(), source, sql);
        return sql;
    }

    /**
     * Resolver falling back to the field name for elements with no explicit mapping.
     */
    @Override
    public Optional<String> resolveFeature(Feature feature) {
        Optional<String> resolved = super.resolveFeature(feature);
        if (resolved.isEmpty() && feature instanceof Element) {
            return Optional.of(feature.name());
        }
        return resolved;
    }

    // ==================== Features ====================

    @Override
    protected String generateElement(String origin, String element) {
        return dialect.quoteIdentifier(origin) + "." + dialect.quoteIdentifier(element);
    }

    @Override
    protected String generateAlias(String feature, String alias) {
        return feature + " AS " + dialect.quoteIdentifier(alias);
    }

    @Override
    protected String generateLiteral(Object value, Kind kind) {
        if (value == null) {
            return dialect.formatNull();
        }
        if (kind instanceof Kind.Primitive primitive) {
            return switch (primitive) {
                case STRING -> dialect.quoteStringLiteral(value.toString());
                case BOOLEAN -> dialect.formatBoolean((Boolean) value);
                case INTEGER, FLOAT -> String.valueOf(value);
                case DECIMAL -> ((BigDecimal) value).toPlainString();
                case TIMESTAMP -> dialect.formatTimestamp((LocalDateTime) value);
                case DATE -> value instanceof LocalDateTime timestamp
                        ? dialect.formatDate(timestamp.toLocalDate())
                        : dialect.formatDate((LocalDate) value);
            };
        }
        if (kind instanceof Kind.Array array && value instanceof List<?> values) {
            return values.stream()
                    .map(v -> generateLiteral(v, array.element()))
                    .collect(Collectors.joining(", ", "ARRAY[", "]"));
        }
        throw new UnsupportedException("Unsupported literal kind: " + kind);
    }

    @Override
    protected String generateExpression(Expression expression, List<String> arguments) {
        if (expression instanceof Comparison comparison) {
            return format(comparisonTemplate(comparison.operator()), arguments);
        }
        if (expression instanceof Logical logical) {
            return format(logicalTemplate(logical.operator()), arguments);
        }
        if (expression instanceof Arithmetic arithmetic) {
            return format("{} " + arithmetic.operator().symbol() + " {}", arguments);
        }
        if (expression instanceof Cast cast) {
            return format("CAST({} AS {})", List.of(arguments.get(0), typeName(cast.kind())));
        }
        if (expression instanceof Aggregate aggregate) {
            return aggregate(aggregate, arguments);
        }
        if (expression instanceof MathFunction math) {
            return format(math.function().name().toLowerCase() + "({})", arguments);
        }
        if (expression instanceof DateFunction date) {
            return format(date.function().name().toLowerCase() + "({})", arguments);
        }
        throw new UnsupportedException("Unsupported expression: " + expression);
    }

    @Override
    protected String generateWindow(Window window, List<String> arguments, List<String> partition,
                                    List<OrderTerm<String>> ordering) {
        if (!(window.function() instanceof Aggregate aggregate)) {
            throw new UnsupportedException("Unsupported window function: " + window.function());
        }
        List<String> clauses = new ArrayList<>();
        if (!partition.isEmpty()) {
            clauses.add("PARTITION BY " + String.join(", ", partition));
        }
        if (!ordering.isEmpty()) {
            clauses.add("ORDER BY " + orderBy(ordering));
        }
        if (window.frame() != null) {
            Window.Frame frame = window.frame();
            clauses.add(frame.mode() + " BETWEEN " + frameBound(frame.start(), "UNBOUNDED PRECEDING")
                    + " AND " + frameBound(frame.end(), "UNBOUNDED FOLLOWING"));
        }
        return aggregate(aggregate, arguments) + " OVER (" + String.join(" ", clauses) + ")";
    }

    private static String frameBound(Integer offset, String unbounded) {
        if (offset == null) {
            return unbounded;
        }
        if (offset == 0) {
            return "CURRENT ROW";
        }
        return offset < 0 ? -offset + " PRECEDING" : offset + " FOLLOWING";
    }

    private static String aggregate(Aggregate aggregate, List<String> arguments) {
        String function = aggregate.function().name().toLowerCase();
        if (arguments.isEmpty()) {
            return function + "(*)";
        }
        return format(function + "({})", arguments);
    }

    private static String comparisonTemplate(Comparison.Operator operator) {
        return switch (operator) {
            case LESS_THAN -> "{} < {}";
            case LESS_EQUAL -> "{} <= {}";
            case GREATER_THAN -> "{} > {}";
            case GREATER_EQUAL -> "{} >= {}";
            case EQUAL -> "{} = {}";
            case NOT_EQUAL -> "{} != {}";
            case IS_NULL -> "{} IS NULL";
            case NOT_NULL -> "{} IS NOT NULL";
        };
    }

    private static String logicalTemplate(Logical.Operator operator) {
        return switch (operator) {
            case AND -> "{} AND {}";
            case OR -> "{} OR {}";
            case NOT -> "NOT {}";
        };
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

    /**
     * Fills the {@code {}} placeholders of the template with the arguments,
     * parenthesizing the non-associative ones.
     */
    private static String format(String template, List<String> arguments) {
        StringBuilder result = new StringBuilder();
        int start = 0;
        for (String argument : arguments) {
            int placeholder = template.indexOf("{}", start);
            if (placeholder < 0) {
                throw new IllegalArgumentException("Too many arguments for " + template);
            }
            result.append(template, start, placeholder);
            boolean associative = ASSOCIATIVE.matcher(argument).matches() || enclosed(argument);
            result.append(associative ? argument : "(" + argument + ")");
            start = placeholder + 2;
        }
        return result.append(template.substring(start)).toString();
    }

    // ==================== Sources ====================

    @Override
    protected String generateTable(String table, List<String> features, String predicate) {
        return dialect.quoteIdentifier(table);
    }

    @Override
    protected Referenced<String> generateReference(String instance, String name) {
        return new Referenced<>(word(instance) + " AS " + dialect.quoteIdentifier(name), name);
    }

    @Override
    protected String generateJoin(String left, String right, String condition, Join.Kind kind) {
        String join = left + " " + joinKeyword(kind) + " " + right;
        if (condition != null) {
            join += " ON " + condition;
        }
        return join;
    }

    private static String joinKeyword(Join.Kind kind) {
        return switch (kind) {
            case INNER -> "JOIN";
            case LEFT -> "LEFT OUTER JOIN";
            case RIGHT -> "RIGHT OUTER JOIN";
            case FULL -> "FULL OUTER JOIN";
            case CROSS -> "CROSS JOIN";
        };
    }

    @Override
    protected String generateSet(String left, String right, SetOperation.Kind kind) {
        String operator = switch (kind) {
            case UNION -> "UNION";
            case INTERSECTION -> "INTERSECT";
            case DIFFERENCE -> "EXCEPT";
        };
        return left + " " + operator + " " + right;
    }

    @Override
    protected String generateQuery(String source, List<String> features, String where, List<String> groupby,
                                   String having, List<OrderTerm<String>> orderby, Rows rows) {
        if (features.isEmpty()) {
            throw new IllegalArgumentException("Expecting features");
        }
        StringBuilder query = new StringBuilder("SELECT ").append(String.join(", ", features))
                .append("\nFROM ").append(subquery(source));
        if (where != null) {
            query.append("\nWHERE ").append(where);
        }
        if (!groupby.isEmpty()) {
            query.append("\nGROUP BY ").append(String.join(", ", groupby));
        }
        if (having != null) {
            query.append("\nHAVING ").append(having);
        }
        if (!orderby.isEmpty()) {
            query.append("\nORDER BY ").append(orderBy(orderby));
        }
        if (rows != null) {
            query.append('\n').append(dialect.formatLimit(rows.count(), rows.offset()));
        }
        return query.toString();
    }

    private static String orderBy(List<OrderTerm<String>> terms) {
        return terms.stream()
                .map(t -> t.feature() + (t.direction() == Ordering.Direction.ASCENDING ? " ASC" : " DESC"))
                .collect(Collectors.joining(", "));
    }

    /**
     * Wraps the value in parentheses unless it is a single word or a function call.
     */
    private static String word(String value) {
        return WORD.matcher(value).matches() || enclosed(value) ? value : "(" + value + ")";
    }

    /**
     * Is the value a single call-like group, a prefix without whitespace followed by
     * parentheses spanning up to its very end? Quoted text does not count towards nesting.
     */
    static boolean enclosed(String value) {
        String text = value.strip();
        int open = text.indexOf('(');
        if (open < 0 || !text.endsWith(")") || !text.substring(0, open).chars().noneMatch(Character::isWhitespace)) {
            return false;
        }
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i == text.length() - 1;
            }
        }
        return false;
    }

    /**
     * Wraps the value in parentheses if it is a SELECT statement.
     */
    private static String subquery(String value) {
        return QUERY.matcher(value).lookingAt() ? "(" + value + ")" : value;
    }
}
