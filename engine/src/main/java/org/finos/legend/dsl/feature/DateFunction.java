package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Extraction of a date part from a date or timestamp operand.
 *
 * @param function The extracted part
 * @param operand  The date operand
 */
public record DateFunction(Function function, Operable operand) implements Expression {

    public enum Function {
        YEAR,
        MONTH,
        DAY
    }

    public DateFunction {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (!Kind.Primitive.DATE.match(operand.kind())) {
            throw new GrammarException(operand + " not an instance of a Date");
        }
    }

    public static DateFunction year(Operable operand) {
        return new DateFunction(Function.YEAR, operand);
    }

    public static DateFunction month(Operable operand) {
        return new DateFunction(Function.MONTH, operand);
    }

    public static DateFunction day(Operable operand) {
        return new DateFunction(Function.DAY, operand);
    }

    @Override
    public Kind kind() {
        return Kind.Primitive.INTEGER;
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
