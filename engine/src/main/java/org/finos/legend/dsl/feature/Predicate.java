package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;

/**
 * Boolean expression (logical or comparison) with its per-table factors.
 */
public sealed interface Predicate extends Expression permits Comparison, Logical {

    /**
     * Ensures the given operable is of boolean kind.
     *
     * @throws GrammarException otherwise
     */
    static Operable ensureIs(Operable feature) {
        if (!Kind.Primitive.BOOLEAN.match(feature.kind())) {
            throw new GrammarException(feature + " not an instance of a Predicate");
        }
        return feature;
    }

    @Override
    default Kind kind() {
        return Kind.Primitive.BOOLEAN;
    }

    /**
     * @return Break down of the sub-predicates involving just a single table
     */
    Factors factors();
}
