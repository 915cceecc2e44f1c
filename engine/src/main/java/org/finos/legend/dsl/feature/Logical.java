package org.finos.legend.dsl.feature;

import java.util.List;
import java.util.Objects;

/**
 * Logical connective of boolean operands.
 *
 * @param operator The logical operator
 * @param left     The left (or only) operand
 * @param right    The right operand (null for NOT)
 */
public record Logical(Operator operator, Operable left, Operable right) implements Predicate {

    public enum Operator {
        AND("AND"),
        OR("OR"),
        NOT("NOT");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Logical {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Predicate.ensureIs(Objects.requireNonNull(left, "Left operand cannot be null"));
        if (operator == Operator.NOT) {
            if (right != null) {
                throw new IllegalArgumentException("NOT takes a single operand");
            }
        } else {
            Predicate.ensureIs(Objects.requireNonNull(right, "Right operand cannot be null"));
        }
    }

    public static Logical and(Operable left, Operable right) {
        return new Logical(Operator.AND, left, right);
    }

    public static Logical or(Operable left, Operable right) {
        return new Logical(Operator.OR, left, right);
    }

    public static Logical not(Operable operand) {
        return new Logical(Operator.NOT, operand, null);
    }

    @Override
    public List<Operable> operands() {
        return right == null ? List.of(left) : List.of(left, right);
    }

    @Override
    public Factors factors() {
        return switch (operator) {
            case AND -> Factors.of(left).and(Factors.of(right));
            case OR -> Factors.of(left).or(Factors.of(right));
            case NOT -> Factors.of(left).negate();
        };
    }

    @Override
    public String toString() {
        return operator == Operator.NOT
                ? operator.symbol() + " " + left
                : left + " " + operator.symbol() + " " + right;
    }
}
