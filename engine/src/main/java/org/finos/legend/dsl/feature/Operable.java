package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.kind.Kind;

/**
 * Feature usable inside further expressions, conditions, groupings and orderings.
 *
 * The builder methods accept either operables or plain values, the latter
 * being wrapped as {@link Literal}s.
 */
public sealed interface Operable extends Feature permits Literal, Element, Expression {

    /**
     * Converts a value to an operable: a feature yields its operable, anything else becomes a literal.
     */
    static Operable of(Object value) {
        if (value instanceof Feature feature) {
            return feature.operable();
        }
        return new Literal(value);
    }

    @Override
    default Operable operable() {
        return this;
    }

    default Aliased alias(String alias) {
        return new Aliased(this, alias);
    }

    // ==================== Comparison ====================

    default Comparison eq(Object other) {
        return Comparison.equal(this, of(other));
    }

    default Comparison ne(Object other) {
        return Comparison.notEqual(this, of(other));
    }

    default Comparison lt(Object other) {
        return Comparison.lessThan(this, of(other));
    }

    default Comparison le(Object other) {
        return Comparison.lessEqual(this, of(other));
    }

    default Comparison gt(Object other) {
        return Comparison.greaterThan(this, of(other));
    }

    default Comparison ge(Object other) {
        return Comparison.greaterEqual(this, of(other));
    }

    default Comparison isNull() {
        return Comparison.isNull(this);
    }

    default Comparison notNull() {
        return Comparison.notNull(this);
    }

    // ==================== Logical ====================

    default Logical and(Object other) {
        return Logical.and(this, of(other));
    }

    default Logical or(Object other) {
        return Logical.or(this, of(other));
    }

    default Logical not() {
        return Logical.not(this);
    }

    // ==================== Arithmetic ====================

    default Arithmetic add(Object other) {
        return Arithmetic.add(this, of(other));
    }

    default Arithmetic sub(Object other) {
        return Arithmetic.subtract(this, of(other));
    }

    default Arithmetic mul(Object other) {
        return Arithmetic.multiply(this, of(other));
    }

    default Arithmetic div(Object other) {
        return Arithmetic.divide(this, of(other));
    }

    default Arithmetic mod(Object other) {
        return Arithmetic.modulus(this, of(other));
    }

    default Cast cast(Kind kind) {
        return new Cast(this, kind);
    }

    // ==================== Ordering ====================

    default Ordering asc() {
        return new Ordering(this, Ordering.Direction.ASCENDING);
    }

    default Ordering desc() {
        return new Ordering(this, Ordering.Direction.DESCENDING);
    }
}
