package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

import java.util.Objects;

/**
 * Constant value feature.
 *
 * @param value The literal value
 * @param kind  The value kind
 */
public record Literal(Object value, Kind kind) implements Operable {

    public Literal(Object value) {
        this(value, reflect(value));
    }

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
        Objects.requireNonNull(kind, "Literal kind cannot be null");
    }

    private static Kind reflect(Object value) {
        try {
            return Kind.reflect(value);
        } catch (IllegalArgumentException e) {
            throw new GrammarException("Invalid literal " + value, e);
        }
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public void accept(FeatureVisitor visitor) {
        visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
