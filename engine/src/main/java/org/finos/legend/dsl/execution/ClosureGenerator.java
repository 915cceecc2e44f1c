package org.finos.legend.dsl.execution;

import org.finos.legend.dsl.UnprovisionedException;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Expression;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Window;
import org.finos.legend.dsl.frame.Join;
import org.finos.legend.dsl.frame.Rows;
import org.finos.legend.dsl.frame.SetOperation;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.kind.Kind;
import org.finos.legend.dsl.parser.Visitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Frame parser compiling a source into a closure evaluating it.
 *
 * Source symbols are closures producing a table, feature symbols are closures
 * producing a column out of the table they are applied to. The actual data
 * manipulation is delegated to the {@code implement*} hooks of the concrete
 * backend, the generated closures just capture their children and call them
 * lazily.
 *
 * Elements are resolved by name: an origin symbol must be a {@link Handle}
 * carrying the name the origin columns are addressed by.
 *
 * @param <T> The table type
 * @param <C> The column type
 */
public abstract class ClosureGenerator<T, C> extends Visitor<Closure<T, T>, Closure<T, C>> {

    /**
     * Named origin closure.
     */
    public record Handle<T>(String name, Closure<T, T> closure) implements Closure<T, T> {
        public Handle {
            Objects.requireNonNull(name, "Handle name cannot be null");
            Objects.requireNonNull(closure, "Handle closure cannot be null");
        }

        @Override
        public T apply(T input) {
            return closure.apply(input);
        }
    }

    /**
     * Element placeholder waiting to be bound to its origin.
     */
    public record Field<T, C>(String name) implements Closure<T, C> {
        @Override
        public C apply(T input) {
            throw new IllegalStateException("Unbound field " + name);
        }
    }

    /**
     * Feature closure giving the backend a chance to serve a precomputed column.
     */
    private final class Columnizer implements Closure<T, C> {
        private final Closure<T, C> body;

        private Columnizer(Closure<T, C> body) {
            this.body = body;
        }

        @Override
        public C apply(T data) {
            return lookup(data, this).orElseGet(() -> body.apply(data));
        }
    }

    protected ClosureGenerator(Map<? extends Source, ? extends Closure<T, T>> sources,
                               Map<? extends Feature, ? extends Closure<T, C>> features) {
        super(sources, features);
    }

    @Override
    public Optional<Closure<T, C>> resolveFeature(Feature feature) {
        Optional<Closure<T, C>> resolved = super.resolveFeature(feature);
        if (resolved.isEmpty() && feature instanceof Element) {
            return Optional.of(new Field<>(feature.name()));
        }
        return resolved;
    }

    // ==================== Backend Hooks ====================

    /**
     * Retrieves the column the given closure has already computed on the data (if any).
     */
    protected Optional<C> lookup(T data, Closure<T, C> column) {
        return Optional.empty();
    }

    protected abstract C implementElement(T data, String origin, String name);

    protected abstract C implementAlias(C column, String alias);

    protected abstract C implementLiteral(T data, Object value, Kind kind);

    protected abstract C implementExpression(T data, Expression expression, List<C> arguments);

    protected abstract C implementWindow(T data, Window window, List<C> arguments, List<C> partition,
                                         List<OrderTerm<C>> ordering);

    protected abstract T implementReference(T table, String name);

    /**
     * @param condition The join condition (null for a cross join)
     */
    protected abstract T implementJoin(T left, T right, Closure<T, C> condition, Join.Kind kind);

    protected abstract T implementSet(T left, T right, SetOperation.Kind kind);

    /**
     * Filters and/or aggregates the table.
     *
     * @param partition  The grouping keys (empty for no grouping)
     * @param expression The features to be computed per group (empty for a plain filter)
     * @param predicate  The row (or group) filter (nullable)
     */
    protected abstract T implementApply(T table, List<Closure<T, C>> partition, List<Closure<T, C>> expression,
                                        Closure<T, C> predicate);

    protected abstract T implementOrdering(T table, List<OrderTerm<Closure<T, C>>> specs);

    protected abstract T implementProject(T table, List<Closure<T, C>> columns);

    protected abstract T implementLimit(T table, int count, int offset);

    /**
     * Runs the query stages: where, grouping with having, ordering, projection and limit.
     */
    protected T implementQuery(T table, List<Closure<T, C>> columns, Closure<T, C> where,
                               List<Closure<T, C>> groupby, Closure<T, C> having,
                               List<OrderTerm<Closure<T, C>>> orderby, Rows rows) {
        if (where != null) {
            table = implementApply(table, List.of(), List.of(), where);
        }
        if (!groupby.isEmpty() || having != null) {
            Set<Closure<T, C>> aggregate = new LinkedHashSet<>(columns);
            orderby.forEach(term -> aggregate.add(term.feature()));
            groupby.forEach(aggregate::remove);
            table = implementApply(table, groupby, new ArrayList<>(aggregate), having);
        }
        if (!orderby.isEmpty()) {
            table = implementOrdering(table, orderby);
        }
        if (!columns.isEmpty()) {
            table = implementProject(table, columns);
        }
        if (rows != null) {
            table = implementLimit(table, rows.count(), rows.offset());
        }
        return table;
    }

    // ==================== Features ====================

    @Override
    protected Closure<T, C> generateElement(Closure<T, T> origin, Closure<T, C> element) {
        if (!(element instanceof Field<T, C> field)) {
            return element;
        }
        if (!(origin instanceof Handle<T> handle)) {
            throw new UnprovisionedException("Anonymous origin of element " + field.name());
        }
        String name = handle.name();
        return new Columnizer(data -> implementElement(data, name, field.name()));
    }

    @Override
    protected Closure<T, C> generateAlias(Closure<T, C> feature, String alias) {
        return new Columnizer(data -> implementAlias(feature.apply(data), alias));
    }

    @Override
    protected Closure<T, C> generateLiteral(Object value, Kind kind) {
        return new Columnizer(data -> implementLiteral(data, value, kind));
    }

    @Override
    protected Closure<T, C> generateExpression(Expression expression, List<Closure<T, C>> arguments) {
        return new Columnizer(data -> implementExpression(data, expression, evaluate(arguments, data)));
    }

    @Override
    protected Closure<T, C> generateWindow(Window window, List<Closure<T, C>> arguments,
                                           List<Closure<T, C>> partition, List<OrderTerm<Closure<T, C>>> ordering) {
        return new Columnizer(data -> {
            List<OrderTerm<C>> terms = new ArrayList<>(ordering.size());
            for (OrderTerm<Closure<T, C>> term : ordering) {
                terms.add(new OrderTerm<>(term.feature().apply(data), term.direction()));
            }
            return implementWindow(data, window, evaluate(arguments, data), evaluate(partition, data), terms);
        });
    }

    private List<C> evaluate(List<Closure<T, C>> closures, T data) {
        List<C> columns = new ArrayList<>(closures.size());
        for (Closure<T, C> closure : closures) {
            columns.add(closure.apply(data));
        }
        return columns;
    }

    // ==================== Sources ====================

    @Override
    protected Referenced<Closure<T, T>> generateReference(Closure<T, T> instance, String name) {
        Handle<T> handle = new Handle<>(name, data -> implementReference(instance.apply(data), name));
        return new Referenced<>(handle, handle);
    }

    @Override
    protected Closure<T, T> generateJoin(Closure<T, T> left, Closure<T, T> right, Closure<T, C> condition,
                                         Join.Kind kind) {
        return data -> implementJoin(left.apply(data), right.apply(data), condition, kind);
    }

    @Override
    protected Closure<T, T> generateSet(Closure<T, T> left, Closure<T, T> right, SetOperation.Kind kind) {
        return data -> implementSet(left.apply(data), right.apply(data), kind);
    }

    @Override
    protected Closure<T, T> generateQuery(Closure<T, T> source, List<Closure<T, C>> features, Closure<T, C> where,
                                          List<Closure<T, C>> groupby, Closure<T, C> having,
                                          List<OrderTerm<Closure<T, C>>> orderby, Rows rows) {
        return data -> implementQuery(source.apply(data), features, where, groupby, having, orderby, rows);
    }
}
