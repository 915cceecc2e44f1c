package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Single-argument numeric function.
 *
 * @param function The function
 * @param operand  The numeric operand
 */
public record MathFunction(Function function, Operable operand) implements Expression {

    public enum Function {
        /** Absolute value, of the operand kind. */
        ABS,
        /** Value rounded up to the nearest integer. */
        CEIL,
        /** Value rounded down to the nearest integer. */
        FLOOR
    }

    public MathFunction {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (!operand.kind().isNumeric()) {
            throw new GrammarException("Invalid arithmetic operand for " + function + "(" + operand + ")");
        }
    }

    public static MathFunction abs(Operable operand) {
        return new MathFunction(Function.ABS, operand);
    }

    public static MathFunction ceil(Operable operand) {
        return new MathFunction(Function.CEIL, operand);
    }

    public static MathFunction floor(Operable operand) {
        return new MathFunction(Function.FLOOR, operand);
    }

    @Override
    public Kind kind() {
        return function == Function.ABS ? operand.kind() : Kind.Primitive.INTEGER;
    }

    @Override
    public List<Operable> operands() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return function.name().toLowerCase() + "(" + operand + ")";
    }
}
