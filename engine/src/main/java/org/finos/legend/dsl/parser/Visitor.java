package org.finos.legend.dsl.parser;

import org.finos.legend.dsl.UnprovisionedException;
import org.finos.legend.dsl.feature.Aliased;
import org.finos.legend.dsl.feature.Column;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Expression;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.FeatureVisitor;
import org.finos.legend.dsl.feature.Literal;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.feature.Ordering;
import org.finos.legend.dsl.feature.Window;
import org.finos.legend.dsl.frame.Join;
import org.finos.legend.dsl.frame.Origin;
import org.finos.legend.dsl.frame.Query;
import org.finos.legend.dsl.frame.Reference;
import org.finos.legend.dsl.frame.Rows;
import org.finos.legend.dsl.frame.SetOperation;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.frame.SourceVisitor;
import org.finos.legend.dsl.frame.Table;
import org.finos.legend.dsl.kind.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic frame parser compiling a source tree into backend target code.
 *
 * The tree is traversed post-order: children are compiled first and their
 * symbols are pushed to the context stack, from where the parent pops them and
 * asks the backend (the {@code generate*} hooks) to combine them into its own
 * symbol.
 *
 * Joins, set operations, queries, expressions and windows are bypassable: after
 * the default compilation, an explicit mapping of the node supplied through the
 * {@code sources}/{@code features} maps replaces the generated symbol.
 *
 * A visitor instance holds mutable parsing state and is not thread-safe, but
 * independent instances can run concurrently.
 *
 * @param <S> The source symbol type
 * @param <F> The feature symbol type
 */
public abstract class Visitor<S, F> extends Container<Object> implements SourceVisitor, FeatureVisitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Visitor.class);

    private final Map<Source, S> sources;
    private final Map<Feature, F> features;
    private final Map<Feature, F> generated = new HashMap<>();

    /**
     * Compiled ordering term.
     */
    public record OrderTerm<F>(F feature, Ordering.Direction direction) {
        public OrderTerm {
            Objects.requireNonNull(direction, "Ordering direction cannot be null");
        }
    }

    /**
     * Compiled reference: the origin defining the reference and the bare handle
     * for addressing its elements.
     */
    public record Referenced<S>(S origin, S handle) {
    }

    protected Visitor(Map<? extends Source, ? extends S> sources, Map<? extends Feature, ? extends F> features) {
        this.sources = Map.copyOf(sources);
        this.features = Map.copyOf(features);
    }

    /**
     * Compiles the given source into a single target code symbol.
     */
    @SuppressWarnings("unchecked")
    public S parse(Source source) {
        try (Scope scope = enter()) {
            source.accept(this);
            return (S) fetch();
        }
    }

    // ==================== Resolution ====================

    /**
     * Explicit target code for a source.
     */
    public Optional<S> resolveSource(Source source) {
        return Optional.ofNullable(sources.get(source));
    }

    /**
     * Explicit target code for a feature.
     */
    public Optional<F> resolveFeature(Feature feature) {
        return Optional.ofNullable(features.get(feature));
    }

    protected final S requireSource(Source source) {
        return resolveSource(source)
                .orElseThrow(() -> new UnprovisionedException("Unknown mapping for source " + source));
    }

    protected final F requireFeature(Feature feature) {
        return resolveFeature(feature)
                .orElseThrow(() -> new UnprovisionedException("Unknown mapping for feature " + feature));
    }

    // ==================== Feature Generation ====================

    /**
     * Generates (or retrieves the already generated) target code of a feature.
     */
    @SuppressWarnings("unchecked")
    public F generateFeature(Feature feature) {
        F symbol = generated.get(feature);
        if (symbol == null) {
            feature.accept(this);
            symbol = (F) context().symbols().pop();
            generated.put(feature, symbol);
        }
        return symbol;
    }

    private List<F> generateFeatures(Collection<? extends Feature> features) {
        List<F> symbols = new ArrayList<>(features.size());
        for (Feature feature : features) {
            symbols.add(generateFeature(feature));
        }
        return symbols;
    }

    private List<OrderTerm<F>> generateOrdering(List<Ordering> ordering) {
        List<OrderTerm<F>> terms = new ArrayList<>(ordering.size());
        for (Ordering term : ordering) {
            terms.add(new OrderTerm<>(generateFeature(term.feature()), term.direction()));
        }
        return terms;
    }

    /**
     * @param origin  Origin handle already in target code
     * @param element Element symbol
     */
    protected abstract F generateElement(S origin, F element);

    protected abstract F generateAlias(F feature, String alias);

    protected abstract F generateLiteral(Object value, Kind kind);

    /**
     * @param expression The expression node (carrying its operator and any non-feature arguments)
     * @param arguments  The expression operands already in target code
     */
    protected abstract F generateExpression(Expression expression, List<F> arguments);

    /**
     * @param window    The window node (carrying its function and frame)
     * @param arguments The window function operands in target code
     * @param partition The partitioning features in target code
     * @param ordering  The ordering terms in target code
     */
    protected abstract F generateWindow(Window window, List<F> arguments, List<F> partition,
                                        List<OrderTerm<F>> ordering);

    @Override
    public void visitAliased(Aliased feature) {
        FeatureVisitor.super.visitAliased(feature);
        push(generateAlias(popFeature(), feature.name()));
    }

    @Override
    public void visitLiteral(Literal feature) {
        FeatureVisitor.super.visitLiteral(feature);
        push(generateLiteral(feature.value(), feature.kind()));
    }

    @Override
    @SuppressWarnings("unchecked")
    public void visitElement(Element feature) {
        FeatureVisitor.super.visitElement(feature);
        Map<Origin, Object> origins = context().origins();
        if (!origins.containsKey(feature.origin())) {
            throw new UnprovisionedException("Unknown origin of " + feature);
        }
        push(generateElement((S) origins.get(feature.origin()), requireFeature(feature)));
    }

    @Override
    public void visitExpression(Expression feature) {
        FeatureVisitor.super.visitExpression(feature);
        int count = feature.operands().size();
        List<F> arguments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            arguments.add(popFeature());
        }
        Collections.reverse(arguments);
        push(generateExpression(feature, arguments));
        bypass(feature, resolveFeature(feature));
    }

    @Override
    public void visitWindow(Window feature) {
        FeatureVisitor.super.visitWindow(feature);
        List<F> arguments = generateFeatures(feature.function().operands());
        List<F> partition = generateFeatures(feature.partition());
        push(generateWindow(feature, arguments, partition, generateOrdering(feature.ordering())));
        bypass(feature, resolveFeature(feature));
    }

    // ==================== Source Generation ====================

    /**
     * Generates the target code of a table given its actual field requirements.
     *
     * @param table     The table symbol (as provided by the source mapping)
     * @param features  The fields of the table required by the query (possibly a subset)
     * @param predicate The row filter that can be pushed down to the table (nullable)
     * @return The table symbol by default
     */
    protected S generateTable(S table, List<F> features, F predicate) {
        return table;
    }

    protected abstract Referenced<S> generateReference(S instance, String name);

    /**
     * @param condition The join condition in target code (null for a cross join)
     */
    protected abstract S generateJoin(S left, S right, F condition, Join.Kind kind);

    protected abstract S generateSet(S left, S right, SetOperation.Kind kind);

    /**
     * @param where  The prefilter in target code (nullable)
     * @param having The postfilter in target code (nullable)
     * @param rows   The row limit (nullable)
     */
    protected abstract S generateQuery(S source, List<F> features, F where, List<F> groupby, F having,
                                       List<OrderTerm<F>> orderby, Rows rows);

    @Override
    public void visitTable(Table source) {
        S origin = requireSource(source);
        context().origins().put(source, origin);
        Tables.Segment segment = context().tables().get(source);
        List<F> fields = new ArrayList<>();
        for (Column column : segment.sortedFields()) {
            fields.add(generateFeature(column));
        }
        Operable predicate = segment.predicate();
        F filter = predicate != null ? generateFeature(predicate) : null;
        SourceVisitor.super.visitTable(source);
        push(generateTable(origin, fields, filter));
    }

    @Override
    public void visitReference(Reference source) {
        SourceVisitor.super.visitReference(source);
        Referenced<S> reference = generateReference(popSource(), source.name());
        context().origins().put(source, reference.handle());
        push(reference.origin());
    }

    @Override
    public void visitJoin(Join source) {
        if (source.condition() != null) {
            context().tables().filter(source.condition());
        }
        SourceVisitor.super.visitJoin(source);
        S right = popSource();
        S left = popSource();
        F condition = source.condition() != null ? generateFeature(source.condition()) : null;
        push(generateJoin(left, right, condition, source.kind()));
        bypass(source, resolveSource(source));
    }

    @Override
    public void visitSet(SetOperation source) {
        SourceVisitor.super.visitSet(source);
        S right = popSource();
        S left = popSource();
        push(generateSet(left, right, source.kind()));
        bypass(source, resolveSource(source));
    }

    @Override
    public void visitQuery(Query source) {
        S query;
        try (Scope scope = enter()) {
            Tables tables = context().tables();
            tables.select(source.features());
            if (source.prefilter() != null) {
                tables.filter(source.prefilter());
            }
            if (source.postfilter() != null) {
                tables.select(source.postfilter());
            }
            tables.select(source.grouping());
            source.ordering().forEach(term -> tables.select(term.feature()));
            SourceVisitor.super.visitQuery(source);
            List<F> features = generateFeatures(source.features());
            F where = source.prefilter() != null ? generateFeature(source.prefilter()) : null;
            List<F> groupby = generateFeatures(source.grouping());
            F having = source.postfilter() != null ? generateFeature(source.postfilter()) : null;
            List<OrderTerm<F>> orderby = generateOrdering(source.ordering());
            query = generateQuery(popSource(), features, where, groupby, having, orderby, source.rows());
        }
        push(query);
        bypass(source, resolveSource(source));
    }

    // ==================== Stack Helpers ====================

    private void push(Object symbol) {
        context().symbols().push(symbol);
    }

    @SuppressWarnings("unchecked")
    private S popSource() {
        return (S) context().symbols().pop();
    }

    @SuppressWarnings("unchecked")
    private F popFeature() {
        return (F) context().symbols().pop();
    }

    /**
     * Replaces the just generated symbol of the subject with its explicit override (if any).
     */
    private void bypass(Object subject, Optional<?> override) {
        override.ifPresent(symbol -> {
            Object old = context().symbols().pop();
            LOGGER.debug("Overriding result for {} ({} -> {})", subject, old, symbol);
            push(symbol);
        });
    }
}
