package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Binary arithmetic operation over numeric operands.
 *
 * @param operator The arithmetic operator
 * @param left     The left operand
 * @param right    The right operand
 */
public record Arithmetic(Operator operator, Operable left, Operable right) implements Expression {

    public enum Operator {
        ADDITION("+"),
        SUBTRACTION("-"),
        MULTIPLICATION("*"),
        DIVISION("/"),
        MODULUS("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Arithmetic {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        if (!left.kind().isNumeric() || !right.kind().isNumeric()) {
            throw new GrammarException("Invalid arithmetic operands for " + left + " " + operator.symbol() + " " + right);
        }
    }

    public static Arithmetic add(Operable left, Operable right) {
        return new Arithmetic(Operator.ADDITION, left, right);
    }

    public static Arithmetic subtract(Operable left, Operable right) {
        return new Arithmetic(Operator.SUBTRACTION, left, right);
    }

    public static Arithmetic multiply(Operable left, Operable right) {
        return new Arithmetic(Operator.MULTIPLICATION, left, right);
    }

    public static Arithmetic divide(Operable left, Operable right) {
        return new Arithmetic(Operator.DIVISION, left, right);
    }

    public static Arithmetic modulus(Operable left, Operable right) {
        return new Arithmetic(Operator.MODULUS, left, right);
    }

    /**
     * Widest of the operand kinds (the first one on a tie).
     */
    static Kind widest(List<Operable> operands) {
        Kind widest = operands.get(0).kind();
        for (Operable operand : operands) {
            if (operand.kind().rank() > widest.rank()) {
                widest = operand.kind();
            }
        }
        return widest;
    }

    @Override
    public Kind kind() {
        return widest(operands());
    }

    @Override
    public List<Operable> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
