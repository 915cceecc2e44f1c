package org.finos.legend.dsl.execution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable in-memory table of named columns of equal length.
 *
 * Columns of a scanned origin are addressed as {@code origin.field}. Besides
 * the named columns, a table can carry computed series keyed by the closure
 * that produced them (the aggregates of a grouped table).
 */
public final class ColumnarTable {

    private static final ColumnarTable EMPTY = new ColumnarTable(List.of(), List.of(), 0, Map.of());

    private final List<String> names;
    private final List<List<Object>> columns;
    private final int rows;
    private final Map<Object, Series> computed;

    /**
     * Column values with an optional name.
     *
     * A single-value series broadcasts to any row index.
     */
    public record Series(String name, List<Object> values) {

        public Series {
            values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values)));
        }

        public int size() {
            return values.size();
        }

        public Object get(int index) {
            return values.get(values.size() == 1 ? 0 : index);
        }

        public Series named(String alias) {
            return new Series(alias, values);
        }
    }

    private ColumnarTable(List<String> names, List<List<Object>> columns, int rows, Map<Object, Series> computed) {
        this.names = names;
        this.columns = columns;
        this.rows = rows;
        this.computed = computed;
    }

    public static ColumnarTable empty() {
        return EMPTY;
    }

    /**
     * Creates a table from named columns (in the map iteration order).
     *
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static ColumnarTable of(Map<String, ? extends List<?>> columns) {
        return ofColumns(new ArrayList<>(columns.keySet()), new ArrayList<>(columns.values()));
    }

    /**
     * Creates a table from parallel lists of column names and column values.
     */
    public static ColumnarTable ofColumns(List<String> names, List<? extends List<?>> columns) {
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException("Expecting " + names.size() + " columns, got " + columns.size());
        }
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        List<List<Object>> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            List<?> column = columns.get(i);
            if (column.size() != rows) {
                throw new IllegalArgumentException(
                        "Column " + names.get(i) + " has " + column.size() + " rows, expected " + rows);
            }
            values.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        return new ColumnarTable(List.copyOf(names), Collections.unmodifiableList(values), rows, Map.of());
    }

    /**
     * Creates a table from row-major records.
     */
    public static ColumnarTable ofRows(List<String> names, List<? extends List<?>> records) {
        List<List<Object>> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            columns.add(new ArrayList<>(records.size()));
        }
        for (List<?> record : records) {
            if (record.size() != names.size()) {
                throw new IllegalArgumentException("Record " + record + " does not match columns " + names);
            }
            for (int i = 0; i < record.size(); i++) {
                columns.get(i).add(record.get(i));
            }
        }
        return ofColumns(names, columns);
    }

    public static Builder builder(String... names) {
        return new Builder(Arrays.asList(names));
    }

    // ==================== Access ====================

    public List<String> columnNames() {
        return names;
    }

    public int columnCount() {
        return names.size();
    }

    public int rowCount() {
        return rows;
    }

    public boolean hasColumn(String name) {
        return names.contains(name);
    }

    /**
     * @throws IllegalArgumentException if there is no such column
     */
    public List<Object> column(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column " + name + " (available: " + names + ")");
        }
        return columns.get(index);
    }

    /**
     * @return All columns in the column-major layout
     */
    public List<List<Object>> columns() {
        return columns;
    }

    public List<Object> row(int index) {
        List<Object> row = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            row.add(column.get(index));
        }
        return row;
    }

    public List<List<Object>> rows() {
        List<List<Object>> records = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            records.add(row(i));
        }
        return records;
    }

    /**
     * @return The series computed by the given closure (null if not computed)
     */
    public Series computed(Object closure) {
        return computed.get(closure);
    }

    // ==================== Transformations ====================

    /**
     * Picks the given rows (in the given order). Index -1 produces a row of nulls.
     */
    public ColumnarTable select(int[] indices) {
        List<List<Object>> values = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            values.add(pick(column, indices));
        }
        Map<Object, Series> picked = new LinkedHashMap<>();
        computed.forEach((key, series) -> picked.put(key, new Series(series.name(), pick(series.values(), indices))));
        return new ColumnarTable(names, Collections.unmodifiableList(values), indices.length,
                Collections.unmodifiableMap(picked));
    }

    public ColumnarTable select(List<Integer> indices) {
        return select(indices.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Renames all columns, dropping any computed series.
     */
    public ColumnarTable renamed(UnaryOperator<String> renamer) {
        List<String> renamed = names.stream().map(renamer).collect(Collectors.toUnmodifiableList());
        return new ColumnarTable(renamed, columns, rows, Map.of());
    }

    /**
     * Attaches computed series (of this table's length) keyed by their producing closures.
     */
    ColumnarTable withComputed(Map<Object, Series> series) {
        Map<Object, Series> merged = new LinkedHashMap<>(computed);
        series.forEach((key, value) -> {
            if (value.size() != rows) {
                throw new IllegalArgumentException("Computed series " + value.name() + " misaligned");
            }
            merged.put(key, value);
        });
        return new ColumnarTable(names, columns, rows, Collections.unmodifiableMap(merged));
    }

    /**
     * Pairs up rows of two tables side by side. Index -1 produces nulls for that side.
     */
    static ColumnarTable combine(ColumnarTable left, int[] leftRows, ColumnarTable right, int[] rightRows) {
        List<String> names = new ArrayList<>(left.names);
        for (String name : right.names) {
            if (names.contains(name)) {
                throw new IllegalArgumentException("Duplicate column " + name);
            }
            names.add(name);
        }
        List<List<Object>> values = new ArrayList<>(left.select(leftRows).columns);
        values.addAll(right.select(rightRows).columns);
        return new ColumnarTable(List.copyOf(names), Collections.unmodifiableList(values), leftRows.length, Map.of());
    }

    private static List<Object> pick(List<Object> values, int[] indices) {
        List<Object> picked = new ArrayList<>(indices.length);
        for (int index : indices) {
            picked.add(index < 0 ? null : values.get(index));
        }
        return Collections.unmodifiableList(picked);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnarTable that)) {
            return false;
        }
        return names.equals(that.names) && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, columns);
    }

    @Override
    public String toString() {
        return "ColumnarTable" + names + "x" + rows;
    }

    /**
     * Row-by-row table builder.
     */
    public static final class Builder {
        private final List<String> names;
        private final List<List<Object>> records = new ArrayList<>();

        private Builder(List<String> names) {
            this.names = List.copyOf(names);
        }

        public Builder row(Object... values) {
            records.add(Arrays.asList(values));
            return this;
        }

        public ColumnarTable build() {
            return ofRows(names, records);
        }
    }
}
