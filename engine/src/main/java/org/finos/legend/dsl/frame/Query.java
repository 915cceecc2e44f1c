package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.feature.Aggregate;
import org.finos.legend.dsl.feature.Cumulative;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Features;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.feature.Ordering;
import org.finos.legend.dsl.feature.Predicate;
import org.finos.legend.dsl.feature.Window;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generic query statement over a source.
 *
 * All the features involved must be derived from the source features. The
 * prefilter and the grouping must not contain cumulative expressions, the
 * postfilter must not contain windows, and once grouped every selected feature
 * which is not a grouping key must be aggregated.
 *
 * @param source     Source to query FROM
 * @param selection  Projected features (empty for all source features)
 * @param prefilter  Row filter applied before aggregation (nullable)
 * @param grouping   Aggregation grouping keys
 * @param postfilter Row filter applied after aggregation (nullable)
 * @param ordering   Ordering specs
 * @param rows       Row limit (nullable)
 */
public record Query(
        Source source,
        List<Feature> selection,
        Operable prefilter,
        List<Operable> grouping,
        Operable postfilter,
        List<Ordering> ordering,
        Rows rows) implements Queryable, Statement {

    public Query(Source source) {
        this(source, List.of(), null, List.of(), null, List.of(), null);
    }

    public Query {
        Objects.requireNonNull(source, "Query source cannot be null");
        Set<Element> superset = Features.dissect(Element.class, source.features());

        selection = selection == null ? List.of() : List.copyOf(selection);
        ensureSubset(superset, selection);

        if (prefilter != null) {
            ensureSubset(superset, List.of(prefilter));
            prefilter = Features.ensureNotIn(Cumulative.class, Predicate.ensureIs(prefilter));
        }

        grouping = grouping == null ? List.of() : List.copyOf(grouping);
        if (!grouping.isEmpty()) {
            for (Operable key : grouping) {
                Features.ensureNotIn(Cumulative.class, key);
            }
            ensureSubset(superset, grouping);
            Set<Operable> aggregates = (selection.isEmpty() ? source.features() : selection).stream()
                    .map(Feature::operable)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            aggregates.removeAll(grouping);
            aggregates.forEach(a -> Features.ensureIn(Aggregate.class, a));
        }

        if (postfilter != null) {
            ensureSubset(superset, List.of(postfilter));
            postfilter = Features.ensureNotIn(Window.class, Predicate.ensureIs(postfilter));
        }

        ordering = ordering == null ? List.of() : List.copyOf(ordering);
        ensureSubset(superset, ordering.stream().map(Ordering::feature).collect(Collectors.toList()));
    }

    private static void ensureSubset(Set<Element> superset, Collection<? extends Feature> features) {
        if (!superset.containsAll(Features.dissect(Element.class, features))) {
            throw new GrammarException(features + " not a subset of source features: " + superset);
        }
    }

    @Override
    public Query query() {
        return this;
    }

    @Override
    public Statement statement() {
        return this;
    }

    @Override
    public List<Feature> features() {
        return selection.isEmpty() ? source.features() : selection;
    }

    @Override
    public Query select(Feature... features) {
        return new Query(source, List.of(features), prefilter, grouping, postfilter, ordering, rows);
    }

    @Override
    public Query where(Operable condition) {
        Operable combined = prefilter != null ? condition.and(prefilter) : condition;
        return new Query(source, selection, combined, grouping, postfilter, ordering, rows);
    }

    @Override
    public Query having(Operable condition) {
        Operable combined = postfilter != null ? condition.and(postfilter) : condition;
        return new Query(source, selection, prefilter, grouping, combined, ordering, rows);
    }

    @Override
    public Query groupby(Operable... features) {
        return new Query(source, selection, prefilter, List.of(features), postfilter, ordering, rows);
    }

    @Override
    public Query orderby(Object... terms) {
        return new Query(source, selection, prefilter, grouping, postfilter, Ordering.make(terms), rows);
    }

    @Override
    public Query limit(int count, int offset) {
        return new Query(source, selection, prefilter, grouping, postfilter, ordering, new Rows(count, offset));
    }

    @Override
    public void accept(SourceVisitor visitor) {
        visitor.visitQuery(this);
    }

    @Override
    public String toString() {
        StringBuilder value = new StringBuilder(String.valueOf(source));
        if (!selection.isEmpty()) {
            value.append(selection.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")));
        }
        if (prefilter != null) {
            value.append(".where(").append(prefilter).append(')');
        }
        if (!grouping.isEmpty()) {
            value.append(grouping.stream().map(String::valueOf).collect(Collectors.joining(", ", ".groupby(", ")")));
        }
        if (postfilter != null) {
            value.append(".having(").append(postfilter).append(')');
        }
        if (!ordering.isEmpty()) {
            value.append(ordering.stream().map(String::valueOf).collect(Collectors.joining(", ", ".orderby(", ")")));
        }
        if (rows != null) {
            value.append('[').append(rows).append(']');
        }
        return value.toString();
    }
}
