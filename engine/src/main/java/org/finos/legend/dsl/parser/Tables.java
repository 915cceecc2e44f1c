package org.finos.legend.dsl.parser;

import org.finos.legend.dsl.feature.Column;
import org.finos.legend.dsl.feature.Factors;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Features;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.frame.Table;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-table bookkeeping of the fields a query needs and of the row predicates
 * that can be pushed down to each table.
 */
public final class Tables {

    private final Map<Table, Segment> segments = new LinkedHashMap<>();

    /**
     * Vertical (fields) and horizontal (factors) slice of a table.
     */
    public static final class Segment {

        private final Set<Column> fields = new LinkedHashSet<>();
        private final Set<Operable> factors = new LinkedHashSet<>();

        public Set<Column> fields() {
            return Collections.unmodifiableSet(fields);
        }

        public Set<Operable> factors() {
            return Collections.unmodifiableSet(factors);
        }

        /**
         * @return The fields ordered by their rendering
         */
        public List<Column> sortedFields() {
            return fields.stream()
                    .sorted(Comparator.comparing(Column::toString))
                    .collect(Collectors.toList());
        }

        /**
         * Combines the factors (ordered by their rendering) into a single OR predicate.
         *
         * @return The combined predicate or null if there are no factors
         */
        public Operable predicate() {
            return factors.stream()
                    .sorted(Comparator.comparing(Operable::toString))
                    .reduce((left, right) -> left.or(right))
                    .orElse(null);
        }
    }

    /**
     * @return The segment of the given table (created empty on first access)
     */
    public Segment get(Table table) {
        return segments.computeIfAbsent(table, t -> new Segment());
    }

    public Set<Table> tables() {
        return Collections.unmodifiableSet(segments.keySet());
    }

    /**
     * Registers the columns found in the given features into the segments of their tables.
     */
    public void select(Collection<? extends Feature> features) {
        for (Column column : Features.dissect(Column.class, features)) {
            get(column.origin()).fields.add(column);
        }
    }

    public void select(Feature... features) {
        select(List.of(features));
    }

    /**
     * Registers the condition columns (see {@link #select}) and its per-table
     * factors into the segments of their tables.
     */
    public void filter(Operable condition) {
        select(condition);
        Factors.of(condition).asMap().forEach((table, factor) -> get(table).factors.add(factor));
    }
}
