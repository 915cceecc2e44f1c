package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.kind.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Explicit conversion of an operand to another kind.
 *
 * @param operand The converted operand
 * @param kind    The target kind
 */
public record Cast(Operable operand, Kind kind) implements Expression {

    public Cast {
        Objects.requireNonNull(operand, "Cast operand cannot be null");
        Objects.requireNonNull(kind, "Cast kind cannot be null");
    }

    @Override
    public List<Operable> operands() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "cast(" + operand + ", " + kind + ")";
    }
}
