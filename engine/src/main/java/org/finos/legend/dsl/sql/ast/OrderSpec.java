package org.finos.legend.dsl.sql.ast;

import java.util.Objects;

/**
 * ORDER BY specification: expression ASC|DESC
 */
public record OrderSpec(Expression expression, Direction direction) implements SQLNode {

    public enum Direction {
        ASC, DESC
    }

    public OrderSpec {
        Objects.requireNonNull(expression, "Order expression cannot be null");
        Objects.requireNonNull(direction, "Order direction cannot be null");
    }

    /**
     * Creates an ascending order spec.
     */
    public static OrderSpec asc(Expression expr) {
        return new OrderSpec(expr, Direction.ASC);
    }

    /**
     * Creates a descending order spec.
     */
    public static OrderSpec desc(Expression expr) {
        return new OrderSpec(expr, Direction.DESC);
    }
}
