package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.schema.Field;
import org.finos.legend.dsl.schema.Schema;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Anything tabular data can be obtained FROM.
 *
 * Sources are immutable values with structural equality, so they can serve as
 * map keys for backend symbol lookups and parser bookkeeping.
 */
public sealed interface Source permits Statement, Queryable {

    /**
     * @return Features logically contained in or produced by this source
     */
    List<Feature> features();

    /**
     * Accepts a source visitor.
     */
    void accept(SourceVisitor visitor);

    /**
     * Schema describing this source, derived from its features.
     */
    default Schema schema() {
        return Schema.of(getClass().getSimpleName(), features().stream()
                .map(f -> Field.of(f.kind(), f.name()))
                .collect(Collectors.toList()));
    }

    /**
     * @return Query equivalent of this source
     */
    default Query query() {
        return new Query(this);
    }

    /**
     * @return Statement equivalent of this source
     */
    default Statement statement() {
        return query();
    }

    /**
     * @return The source instance (which is the source itself for anything but a reference)
     */
    default Source instance() {
        return this;
    }

    /**
     * Looks a feature up by its schema key or name.
     *
     * @throws GrammarException if there is no such feature
     */
    default Feature get(String name) {
        Schema schema = schema();
        String fieldName;
        try {
            fieldName = schema.get(name).name();
        } catch (IllegalArgumentException e) {
            throw new GrammarException("Invalid feature " + name + " of " + this, e);
        }
        List<Field> fields = schema.fields();
        List<Feature> features = features();
        for (int i = 0; i < fields.size(); i++) {
            if (fieldName.equals(fields.get(i).name())) {
                return features.get(i);
            }
        }
        throw new IllegalStateException("Inconsistent " + name + " lookup vs schema iteration");
    }

    /**
     * Creates an independent reference to this source under a random name.
     */
    default Reference reference() {
        return new Reference(this, null);
    }

    /**
     * Creates an independent reference to this source (e.g. for self-joins).
     */
    default Reference reference(String name) {
        return new Reference(this, name);
    }

    default SetOperation union(Source other) {
        return new SetOperation(this, other, SetOperation.Kind.UNION);
    }

    default SetOperation intersection(Source other) {
        return new SetOperation(this, other, SetOperation.Kind.INTERSECTION);
    }

    default SetOperation difference(Source other) {
        return new SetOperation(this, other, SetOperation.Kind.DIFFERENCE);
    }
}
