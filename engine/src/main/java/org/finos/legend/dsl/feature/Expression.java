package org.finos.legend.dsl.feature;

import java.util.List;

/**
 * Anonymous feature computed from its operands.
 */
public sealed interface Expression extends Operable
        permits Predicate, Arithmetic, MathFunction, Cast, DateFunction, Cumulative {

    /**
     * @return Feature operands in their positional order
     */
    List<Operable> operands();

    @Override
    default String name() {
        return null;
    }

    @Override
    default void accept(FeatureVisitor visitor) {
        visitor.visitExpression(this);
    }
}
