package org.finos.legend.dsl.execution;

import org.finos.legend.dsl.UnsupportedException;
import org.finos.legend.dsl.execution.ColumnarTable.Series;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.Arithmetic;
import org.finos.legend.dsl.feature.Cast;
import org.finos.legend.dsl.feature.Comparison;
import org.finos.legend.dsl.feature.DateFunction;
import org.finos.legend.dsl.feature.Expression;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Logical;
import org.finos.legend.dsl.feature.MathFunction;
import org.finos.legend.dsl.feature.Ordering;
import org.finos.legend.dsl.feature.Window;
import org.finos.legend.dsl.frame.Join;
import org.finos.legend.dsl.frame.SetOperation;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.frame.Table;
import org.finos.legend.dsl.kind.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Closure backend evaluating sources over in-memory {@link ColumnarTable}s.
 *
 * The input tables are keyed by their DSL {@link Table}s with columns named by
 * the field names. Scanned columns are qualified as {@code origin.field}, query
 * results carry the plain feature names.
 *
 * Nulls follow the SQL semantics: they propagate through operators, fail
 * filters, are skipped by aggregates and sort last.
 */
public final class ColumnarEvaluator extends ClosureGenerator<ColumnarTable, Series> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnarEvaluator.class);

    public ColumnarEvaluator(Map<Table, ColumnarTable> tables) {
        this(tables, Map.of());
    }

    public ColumnarEvaluator(Map<Table, ColumnarTable> tables,
                             Map<? extends Feature, ? extends Closure<ColumnarTable, Series>> features) {
        super(scans(tables), features);
    }

    private static Map<Source, Closure<ColumnarTable, ColumnarTable>> scans(Map<Table, ColumnarTable> tables) {
        Map<Source, Closure<ColumnarTable, ColumnarTable>> scans = new HashMap<>();
        tables.forEach((table, data) -> {
            String name = table.schema().name();
            ColumnarTable qualified = data.renamed(column -> name + "." + column);
            scans.put(table, new Handle<>(name, input -> qualified));
        });
        return scans;
    }

    /**
     * Compiles and runs the given source.
     */
    public ColumnarTable evaluate(Source source) {
        ColumnarTable result = parse(source).apply(ColumnarTable.empty());
        LOGGER.debug("Evaluated {} into {}", source, result);
        return result;
    }

    @Override
    protected Optional<Series> lookup(ColumnarTable data, Closure<ColumnarTable, Series> column) {
        return Optional.ofNullable(data.computed(column));
    }

    // ==================== Features ====================

    @Override
    protected Series implementElement(ColumnarTable data, String origin, String name) {
        return new Series(name, data.column(origin + "." + name));
    }

    @Override
    protected Series implementAlias(Series column, String alias) {
        return column.named(alias);
    }

    @Override
    protected Series implementLiteral(ColumnarTable data, Object value, Kind kind) {
        return new Series(null, Collections.nCopies(data.rowCount(), value));
    }

    @Override
    protected Series implementExpression(ColumnarTable data, Expression expression, List<Series> arguments) {
        if (expression instanceof Comparison comparison) {
            return comparison(comparison.operator(), arguments);
        }
        if (expression instanceof Logical logical) {
            return logical(logical.operator(), arguments);
        }
        if (expression instanceof Arithmetic arithmetic) {
            return zip(arguments.get(0), arguments.get(1), (l, r) -> arithmetic(arithmetic.operator(), l, r));
        }
        if (expression instanceof Cast cast) {
            return map(arguments.get(0), cast.kind()::cast);
        }
        if (expression instanceof Aggregate aggregate) {
            List<Object> values = arguments.isEmpty() ? null : arguments.get(0).values();
            return new Series(null, Collections.singletonList(aggregate(aggregate.function(), values,
                    data.rowCount())));
        }
        if (expression instanceof MathFunction math) {
            return map(arguments.get(0), value -> math(math.function(), value));
        }
        if (expression instanceof DateFunction date) {
            return map(arguments.get(0), value -> date(date.function(), value));
        }
        throw new UnsupportedException("Unsupported expression: " + expression);
    }

    /**
     * Evaluates an aggregate over the default frame: the whole partition without
     * ordering, the partition prefix up to the last peer of the current row otherwise.
     */
    @Override
    protected Series implementWindow(ColumnarTable data, Window window, List<Series> arguments,
                                     List<Series> partition, List<OrderTerm<Series>> ordering) {
        if (window.frame() != null) {
            throw new UnsupportedException("Explicit window frame not supported: " + window.frame());
        }
        Aggregate.Function function = ((Aggregate) window.function()).function();
        Series argument = arguments.isEmpty() ? null : arguments.get(0);
        Comparator<Integer> order = rowOrder(ordering);
        Object[] result = new Object[data.rowCount()];
        for (List<Integer> rows : groups(partition, data.rowCount()).values()) {
            List<Integer> sorted = new ArrayList<>(rows);
            sorted.sort(order);
            int start = 0;
            while (start < sorted.size()) {
                int end = start;
                if (ordering.isEmpty()) {
                    end = sorted.size() - 1;
                } else {
                    while (end + 1 < sorted.size() && order.compare(sorted.get(end + 1), sorted.get(start)) == 0) {
                        end++;
                    }
                }
                List<Integer> frame = sorted.subList(0, end + 1);
                Object value = aggregate(function, values(argument, frame), frame.size());
                for (int i = start; i <= end; i++) {
                    result[sorted.get(i)] = value;
                }
                start = end + 1;
            }
        }
        return new Series(null, Arrays.asList(result));
    }

    // ==================== Sources ====================

    @Override
    protected ColumnarTable implementReference(ColumnarTable table, String name) {
        return table.renamed(column -> name + "." + column.substring(column.indexOf('.') + 1));
    }

    @Override
    protected ColumnarTable implementJoin(ColumnarTable left, ColumnarTable right,
                                          Closure<ColumnarTable, Series> condition, Join.Kind kind) {
        int size = left.rowCount() * right.rowCount();
        int[] leftRows = new int[size];
        int[] rightRows = new int[size];
        for (int i = 0; i < size; i++) {
            leftRows[i] = i / right.rowCount();
            rightRows[i] = i % right.rowCount();
        }
        ColumnarTable product = ColumnarTable.combine(left, leftRows, right, rightRows);
        if (condition == null || kind == Join.Kind.CROSS) {
            return product;
        }
        Series mask = condition.apply(product);
        List<Integer> lefts = new ArrayList<>();
        List<Integer> rights = new ArrayList<>();
        boolean[] leftMatched = new boolean[left.rowCount()];
        boolean[] rightMatched = new boolean[right.rowCount()];
        for (int i = 0; i < size; i++) {
            if (isTrue(mask.get(i))) {
                lefts.add(leftRows[i]);
                rights.add(rightRows[i]);
                leftMatched[leftRows[i]] = true;
                rightMatched[rightRows[i]] = true;
            }
        }
        if (kind == Join.Kind.LEFT || kind == Join.Kind.FULL) {
            for (int i = 0; i < leftMatched.length; i++) {
                if (!leftMatched[i]) {
                    lefts.add(i);
                    rights.add(-1);
                }
            }
        }
        if (kind == Join.Kind.RIGHT || kind == Join.Kind.FULL) {
            for (int i = 0; i < rightMatched.length; i++) {
                if (!rightMatched[i]) {
                    lefts.add(-1);
                    rights.add(i);
                }
            }
        }
        return ColumnarTable.combine(left, toArray(lefts), right, toArray(rights));
    }

    @Override
    protected ColumnarTable implementSet(ColumnarTable left, ColumnarTable right, SetOperation.Kind kind) {
        if (left.columnCount() != right.columnCount()) {
            throw new IllegalArgumentException("Set operands differ in width: " + left + " vs " + right);
        }
        Set<List<Object>> result = new LinkedHashSet<>();
        switch (kind) {
            case UNION -> {
                result.addAll(left.rows());
                result.addAll(right.rows());
            }
            case INTERSECTION -> {
                Set<List<Object>> other = new HashSet<>(right.rows());
                left.rows().stream().filter(other::contains).forEach(result::add);
            }
            case DIFFERENCE -> {
                Set<List<Object>> other = new HashSet<>(right.rows());
                left.rows().stream().filter(row -> !other.contains(row)).forEach(result::add);
            }
        }
        return ColumnarTable.ofRows(left.columnNames(), new ArrayList<>(result));
    }

    @Override
    protected ColumnarTable implementApply(ColumnarTable table, List<Closure<ColumnarTable, Series>> partition,
                                           List<Closure<ColumnarTable, Series>> expression,
                                           Closure<ColumnarTable, Series> predicate) {
        if (partition.isEmpty() && expression.isEmpty()) {
            if (predicate == null) {
                return table;
            }
            Series mask = predicate.apply(table);
            return table.select(IntStream.range(0, table.rowCount()).filter(i -> isTrue(mask.get(i))).toArray());
        }
        List<Series> keys = new ArrayList<>(partition.size());
        for (Closure<ColumnarTable, Series> closure : partition) {
            keys.add(closure.apply(table));
        }
        Map<List<Object>, List<Integer>> groups = groups(keys, table.rowCount());
        if (partition.isEmpty() && groups.isEmpty()) {
            groups.put(List.of(), List.of());
        }
        List<Integer> representatives = new ArrayList<>();
        Map<Closure<ColumnarTable, Series>, List<Object>> computed = new LinkedHashMap<>();
        Map<Closure<ColumnarTable, Series>, String> names = new HashMap<>();
        partition.forEach(closure -> computed.put(closure, new ArrayList<>()));
        expression.forEach(closure -> computed.put(closure, new ArrayList<>()));
        for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
            ColumnarTable rows = table.select(group.getValue());
            List<Object> aggregates = new ArrayList<>(expression.size());
            for (Closure<ColumnarTable, Series> closure : expression) {
                Series series = closure.apply(rows);
                aggregates.add(first(series));
                names.put(closure, series.name());
            }
            for (int i = 0; i < partition.size(); i++) {
                names.put(partition.get(i), keys.get(i).name());
            }
            if (predicate != null && !isTrue(first(predicate.apply(rows)))) {
                continue;
            }
            representatives.add(group.getValue().isEmpty() ? -1 : group.getValue().get(0));
            for (int i = 0; i < partition.size(); i++) {
                computed.get(partition.get(i)).add(group.getKey().get(i));
            }
            for (int i = 0; i < expression.size(); i++) {
                computed.get(expression.get(i)).add(aggregates.get(i));
            }
        }
        Map<Object, Series> series = new LinkedHashMap<>();
        computed.forEach((closure, values) -> series.put(closure, new Series(names.get(closure), values)));
        return table.select(toArray(representatives)).withComputed(series);
    }

    @Override
    protected ColumnarTable implementOrdering(ColumnarTable table,
                                              List<OrderTerm<Closure<ColumnarTable, Series>>> specs) {
        List<OrderTerm<Series>> terms = new ArrayList<>(specs.size());
        for (OrderTerm<Closure<ColumnarTable, Series>> spec : specs) {
            terms.add(new OrderTerm<>(spec.feature().apply(table), spec.direction()));
        }
        List<Integer> rows = new ArrayList<>();
        IntStream.range(0, table.rowCount()).forEach(rows::add);
        rows.sort(rowOrder(terms));
        return table.select(rows);
    }

    @Override
    protected ColumnarTable implementProject(ColumnarTable table, List<Closure<ColumnarTable, Series>> columns) {
        List<Series> series = new ArrayList<>(columns.size());
        for (Closure<ColumnarTable, Series> column : columns) {
            series.add(column.apply(table));
        }
        int size = series.stream().mapToInt(Series::size).max().orElse(0);
        List<String> names = new ArrayList<>(series.size());
        List<List<Object>> values = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            Series column = series.get(i);
            if (column.size() != size && column.size() != 1) {
                throw new IllegalArgumentException("Misaligned column " + column.name() + " in projection");
            }
            names.add(column.name() != null ? column.name() : "_" + i);
            List<Object> broadcast = new ArrayList<>(size);
            for (int row = 0; row < size; row++) {
                broadcast.add(column.get(row));
            }
            values.add(broadcast);
        }
        return ColumnarTable.ofColumns(names, values);
    }

    @Override
    protected ColumnarTable implementLimit(ColumnarTable table, int count, int offset) {
        int end = (int) Math.min((long) offset + count, table.rowCount());
        return table.select(IntStream.range(Math.min(offset, end), end).toArray());
    }

    // ==================== Operators ====================

    private static Series comparison(Comparison.Operator operator, List<Series> arguments) {
        Series left = arguments.get(0);
        return switch (operator) {
            case IS_NULL -> test(left, value -> value == null);
            case NOT_NULL -> test(left, value -> value != null);
            case EQUAL -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) == 0);
            case NOT_EQUAL -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) != 0);
            case LESS_THAN -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) < 0);
            case LESS_EQUAL -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) <= 0);
            case GREATER_THAN -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) > 0);
            case GREATER_EQUAL -> zip(left, arguments.get(1), (l, r) -> compareValues(l, r) >= 0);
        };
    }

    /**
     * Three-valued logic: unknown (null) unless decided by a false (AND) or true (OR) operand.
     */
    private static Series logical(Logical.Operator operator, List<Series> arguments) {
        return switch (operator) {
            case NOT -> map(arguments.get(0), value -> !(Boolean) value);
            case AND -> zipNullable(arguments.get(0), arguments.get(1), (l, r) -> {
                if (Boolean.FALSE.equals(l) || Boolean.FALSE.equals(r)) {
                    return false;
                }
                return l == null || r == null ? null : Boolean.TRUE;
            });
            case OR -> zipNullable(arguments.get(0), arguments.get(1), (l, r) -> {
                if (Boolean.TRUE.equals(l) || Boolean.TRUE.equals(r)) {
                    return true;
                }
                return l == null || r == null ? null : Boolean.FALSE;
            });
        };
    }

    private static Object arithmetic(Arithmetic.Operator operator, Object left, Object right) {
        Number l = (Number) left;
        Number r = (Number) right;
        // division and modulus by zero yield NULL as in SQL engines
        if ((operator == Arithmetic.Operator.DIVISION || operator == Arithmetic.Operator.MODULUS) && isZero(r)) {
            return null;
        }
        if (isFloating(l) || isFloating(r)) {
            double x = l.doubleValue();
            double y = r.doubleValue();
            return switch (operator) {
                case ADDITION -> x + y;
                case SUBTRACTION -> x - y;
                case MULTIPLICATION -> x * y;
                case DIVISION -> x / y;
                case MODULUS -> x % y;
            };
        }
        if (l instanceof BigDecimal || r instanceof BigDecimal) {
            BigDecimal x = decimal(l);
            BigDecimal y = decimal(r);
            return switch (operator) {
                case ADDITION -> x.add(y);
                case SUBTRACTION -> x.subtract(y);
                case MULTIPLICATION -> x.multiply(y);
                case DIVISION -> x.divide(y, MathContext.DECIMAL64);
                case MODULUS -> x.remainder(y);
            };
        }
        long x = l.longValue();
        long y = r.longValue();
        return switch (operator) {
            case ADDITION -> x + y;
            case SUBTRACTION -> x - y;
            case MULTIPLICATION -> x * y;
            case DIVISION -> x / y;
            case MODULUS -> x % y;
        };
    }

    private static boolean isZero(Number value) {
        return value instanceof BigDecimal decimal ? decimal.signum() == 0 : value.doubleValue() == 0;
    }

    private static Object aggregate(Aggregate.Function function, List<Object> values, int rows) {
        if (function == Aggregate.Function.COUNT) {
            return values == null ? (long) rows : values.stream().filter(v -> v != null).count();
        }
        List<Object> present = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                present.add(value);
            }
        }
        if (present.isEmpty()) {
            return null;
        }
        BinaryOperator<Object> sum = (l, r) -> arithmetic(Arithmetic.Operator.ADDITION, l, r);
        return switch (function) {
            case SUM -> present.stream().reduce(sum).orElseThrow();
            case AVG -> {
                Object total = present.stream().reduce(sum).orElseThrow();
                yield total instanceof BigDecimal decimal
                        ? decimal.divide(BigDecimal.valueOf(present.size()), MathContext.DECIMAL64)
                        : ((Number) total).doubleValue() / present.size();
            }
            case MIN -> Collections.min(present, ColumnarEvaluator::compareValues);
            case MAX -> Collections.max(present, ColumnarEvaluator::compareValues);
            case COUNT -> throw new IllegalStateException("Unreachable");
        };
    }

    private static Object math(MathFunction.Function function, Object value) {
        Number number = (Number) value;
        if (function == MathFunction.Function.ABS) {
            if (number instanceof BigDecimal decimal) {
                return decimal.abs();
            }
            return isFloating(number) ? (Object) Math.abs(number.doubleValue()) : (Object) Math.abs(number.longValue());
        }
        RoundingMode mode = function == MathFunction.Function.CEIL ? RoundingMode.CEILING : RoundingMode.FLOOR;
        return decimal(number).setScale(0, mode).longValueExact();
    }

    private static Object date(DateFunction.Function function, Object value) {
        LocalDate date = value instanceof LocalDateTime timestamp ? timestamp.toLocalDate() : (LocalDate) value;
        return switch (function) {
            case YEAR -> (long) date.getYear();
            case MONTH -> (long) date.getMonthValue();
            case DAY -> (long) date.getDayOfMonth();
        };
    }

    // ==================== Helpers ====================

    /**
     * Element-wise null-propagating function.
     */
    private static Series map(Series series, UnaryOperator<Object> function) {
        List<Object> values = new ArrayList<>(series.size());
        for (Object value : series.values()) {
            values.add(value == null ? null : function.apply(value));
        }
        return new Series(null, values);
    }

    private static Series test(Series series, Predicate<Object> predicate) {
        List<Object> values = new ArrayList<>(series.size());
        for (Object value : series.values()) {
            values.add(predicate.test(value));
        }
        return new Series(null, values);
    }

    /**
     * Element-wise null-propagating binary function (single-value series broadcast).
     */
    private static Series zip(Series left, Series right, BinaryOperator<Object> function) {
        return zipNullable(left, right, (l, r) -> l == null || r == null ? null : function.apply(l, r));
    }

    private static Series zipNullable(Series left, Series right, BinaryOperator<Object> function) {
        int size;
        if (left.size() == right.size() || right.size() == 1) {
            size = left.size();
        } else if (left.size() == 1) {
            size = right.size();
        } else {
            throw new IllegalArgumentException("Misaligned operands of size " + left.size() + " and " + right.size());
        }
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(function.apply(left.get(i), right.get(i)));
        }
        return new Series(null, values);
    }

    private static Map<List<Object>, List<Integer>> groups(List<Series> keys, int rows) {
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows; i++) {
            List<Object> key = new ArrayList<>(keys.size());
            for (Series series : keys) {
                key.add(series.get(i));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    private static List<Object> values(Series series, List<Integer> rows) {
        if (series == null) {
            return null;
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (int row : rows) {
            values.add(series.get(row));
        }
        return values;
    }

    private static Comparator<Integer> rowOrder(List<OrderTerm<Series>> terms) {
        Comparator<Integer> order = (a, b) -> 0;
        for (OrderTerm<Series> term : terms) {
            Series series = term.feature();
            int sign = term.direction() == Ordering.Direction.DESCENDING ? -1 : 1;
            order = order.thenComparing((a, b) -> {
                Object l = series.get(a);
                Object r = series.get(b);
                if (l == null || r == null) {
                    return l == null ? (r == null ? 0 : 1) : -1;
                }
                return sign * compareValues(l, r);
            });
        }
        return order;
    }

    @SuppressWarnings("unchecked")
    static int compareValues(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return decimal(l).compareTo(decimal(r));
        }
        if (left instanceof LocalDate date && right instanceof LocalDateTime) {
            left = date.atStartOfDay();
        } else if (left instanceof LocalDateTime && right instanceof LocalDate date) {
            right = date.atStartOfDay();
        }
        return ((Comparable<Object>) left).compareTo(right);
    }

    private static BigDecimal decimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        return isFloating(number) ? BigDecimal.valueOf(number.doubleValue()) : BigDecimal.valueOf(number.longValue());
    }

    private static boolean isFloating(Number number) {
        return number instanceof Double || number instanceof Float;
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value);
    }

    private static Object first(Series series) {
        return series.size() == 0 ? null : series.get(0);
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
