package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.feature.Operable;

/**
 * Queryable source with a handle. Its features are elements bound to it.
 */
public sealed interface Origin extends Queryable permits Table, Reference, Join {

    default Join join(Origin other, Operable condition) {
        return innerJoin(other, condition);
    }

    default Join innerJoin(Origin other, Operable condition) {
        return new Join(this, other, Join.Kind.INNER, condition);
    }

    default Join leftJoin(Origin other, Operable condition) {
        return new Join(this, other, Join.Kind.LEFT, condition);
    }

    default Join rightJoin(Origin other, Operable condition) {
        return new Join(this, other, Join.Kind.RIGHT, condition);
    }

    default Join fullJoin(Origin other, Operable condition) {
        return new Join(this, other, Join.Kind.FULL, condition);
    }

    default Join crossJoin(Origin other) {
        return new Join(this, other, Join.Kind.CROSS, null);
    }
}
