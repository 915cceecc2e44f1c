package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.frame.Table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

/**
 * Read-only mapping of tables to their primitive predicates.
 *
 * A primitive predicate (factor) involves columns of exactly one table, which
 * makes it a candidate for filter push-down to that table.
 */
public final class Factors {

    private static final Factors EMPTY = new Factors(Map.of());

    private final Map<Table, Operable> items;

    private Factors(Map<Table, Operable> items) {
        this.items = items;
    }

    public static Factors empty() {
        return EMPTY;
    }

    /**
     * Creates factors of primitive predicates.
     *
     * @throws IllegalArgumentException if any predicate is not primitive or two predicates share a table
     */
    public static Factors primitive(Operable... predicates) {
        Map<Table, Operable> items = new LinkedHashMap<>();
        for (Operable predicate : predicates) {
            Set<Table> tables = tables(predicate);
            if (tables.size() != 1 || items.putIfAbsent(tables.iterator().next(), predicate) != null) {
                throw new IllegalArgumentException("Repeated or non-primitive predicates");
            }
        }
        return new Factors(Collections.unmodifiableMap(items));
    }

    /**
     * Factors of an arbitrary boolean operable: its own factors if it is a
     * predicate, itself if it is a primitive non-predicate, nothing otherwise.
     */
    public static Factors of(Operable condition) {
        if (condition instanceof Predicate predicate) {
            return predicate.factors();
        }
        return tables(condition).size() == 1 ? primitive(condition) : EMPTY;
    }

    private static Set<Table> tables(Operable predicate) {
        return Features.dissect(Column.class, predicate).stream()
                .map(Column::origin)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Combines each table's factors with the operator when both sides have a
     * distinct one, keeping the one-sided factors as they are.
     */
    private static Factors merge(Factors left, Factors right, BinaryOperator<Operable> operator) {
        Set<Table> tables = new LinkedHashSet<>(left.items.keySet());
        tables.addAll(right.items.keySet());
        Operable[] merged = tables.stream().map(table -> {
            Operable l = left.items.get(table);
            Operable r = right.items.get(table);
            if (l != null && r != null && !l.equals(r)) {
                return operator.apply(l, r);
            }
            return l != null ? l : r;
        }).toArray(Operable[]::new);
        return primitive(merged);
    }

    public Factors and(Factors other) {
        return merge(this, other, Logical::and);
    }

    public Factors or(Factors other) {
        return merge(this, other, Logical::or);
    }

    /**
     * @return Factors with every predicate negated
     */
    public Factors negate() {
        return primitive(items.values().stream().map(Logical::not).toArray(Operable[]::new));
    }

    public Optional<Operable> get(Table table) {
        return Optional.ofNullable(items.get(table));
    }

    public Set<Table> tables() {
        return items.keySet();
    }

    public Map<Table, Operable> asMap() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Factors other && items.equals(other.items));
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
