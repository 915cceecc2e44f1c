package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Comparison predicate. Operands must be either all numeric or all of the same kind.
 *
 * @param operator The comparison operator
 * @param left     The left (or only) operand
 * @param right    The right operand (null for the null tests)
 */
public record Comparison(Operator operator, Operable left, Operable right) implements Predicate {

    public enum Operator {
        LESS_THAN("<", true),
        LESS_EQUAL("<=", true),
        GREATER_THAN(">", true),
        GREATER_EQUAL(">=", true),
        EQUAL("==", true),
        NOT_EQUAL("!=", true),
        IS_NULL("IS NULL", false),
        NOT_NULL("IS NOT NULL", false);

        private final String symbol;
        private final boolean binary;

        Operator(String symbol, boolean binary) {
            this.symbol = symbol;
            this.binary = binary;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isBinary() {
            return binary;
        }
    }

    public Comparison {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        if (operator.isBinary()) {
            Objects.requireNonNull(right, "Right operand cannot be null");
            boolean numeric = left.kind().isNumeric() && right.kind().isNumeric();
            if (!numeric && !left.kind().equals(right.kind())) {
                throw new GrammarException("Invalid operands for " + left + " " + operator.symbol() + " "
                        + right + " comparison");
            }
        } else if (right != null) {
            throw new IllegalArgumentException(operator + " takes a single operand");
        }
    }

    public static Comparison lessThan(Operable left, Operable right) {
        return new Comparison(Operator.LESS_THAN, left, right);
    }

    public static Comparison lessEqual(Operable left, Operable right) {
        return new Comparison(Operator.LESS_EQUAL, left, right);
    }

    public static Comparison greaterThan(Operable left, Operable right) {
        return new Comparison(Operator.GREATER_THAN, left, right);
    }

    public static Comparison greaterEqual(Operable left, Operable right) {
        return new Comparison(Operator.GREATER_EQUAL, left, right);
    }

    public static Comparison equal(Operable left, Operable right) {
        return new Comparison(Operator.EQUAL, left, right);
    }

    public static Comparison notEqual(Operable left, Operable right) {
        return new Comparison(Operator.NOT_EQUAL, left, right);
    }

    public static Comparison isNull(Operable operand) {
        return new Comparison(Operator.IS_NULL, operand, null);
    }

    public static Comparison notNull(Operable operand) {
        return new Comparison(Operator.NOT_NULL, operand, null);
    }

    @Override
    public List<Operable> operands() {
        return right == null ? List.of(left) : List.of(left, right);
    }

    /**
     * A comparison is a factor of its table if its columns all come from that single table.
     */
    @Override
    public Factors factors() {
        long tables = Features.dissect(Column.class, this).stream()
                .map(Column::origin)
                .collect(Collectors.toSet())
                .size();
        return tables == 1 ? Factors.primitive(this) : Factors.empty();
    }

    @Override
    public String toString() {
        return right == null
                ? left + " " + operator.symbol()
                : left + " " + operator.symbol() + " " + right;
    }
}
