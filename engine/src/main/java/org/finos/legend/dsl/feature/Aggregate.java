package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Aggregation of a group of rows into a single value.
 *
 * Aggregates can also be evaluated over a window, see {@link #over}.
 *
 * @param function The aggregate function
 * @param operand  The aggregated operand (null only for counting rows)
 */
public record Aggregate(Function function, Operable operand) implements Cumulative, Window.Function {

    public enum Function {
        COUNT,
        AVG,
        MIN,
        MAX,
        SUM
    }

    public Aggregate {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        if (operand == null) {
            if (function != Function.COUNT) {
                throw new GrammarException(function + " requires an operand");
            }
        } else if (function != Function.COUNT && !operand.kind().isNumeric()) {
            throw new GrammarException("Invalid arithmetic operand for " + function + "(" + operand + ")");
        }
    }

    /**
     * Number of rows.
     */
    public static Aggregate count() {
        return new Aggregate(Function.COUNT, null);
    }

    /**
     * Number of rows with a non-null operand.
     */
    public static Aggregate count(Operable operand) {
        return new Aggregate(Function.COUNT, operand);
    }

    public static Aggregate avg(Operable operand) {
        return new Aggregate(Function.AVG, operand);
    }

    public static Aggregate min(Operable operand) {
        return new Aggregate(Function.MIN, operand);
    }

    public static Aggregate max(Operable operand) {
        return new Aggregate(Function.MAX, operand);
    }

    public static Aggregate sum(Operable operand) {
        return new Aggregate(Function.SUM, operand);
    }

    @Override
    public Kind kind() {
        return function == Function.COUNT ? Kind.Primitive.INTEGER : operand.kind();
    }

    @Override
    public List<Operable> operands() {
        return operand == null ? List.of() : List.of(operand);
    }

    @Override
    public String toString() {
        return function.name().toLowerCase() + "(" + (operand == null ? "*" : operand) + ")";
    }
}
