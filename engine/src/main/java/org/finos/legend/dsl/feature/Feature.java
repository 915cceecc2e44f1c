package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.kind.Kind;

/**
 * Column-level expression: a field reference, literal, operator result,
 * aggregate or window, possibly aliased.
 *
 * Features are immutable values with structural equality.
 */
public sealed interface Feature permits Operable, Aliased {

    /**
     * @return Feature name, or null for anonymous features
     */
    String name();

    /**
     * @return Kind of the values this feature produces
     */
    Kind kind();

    /**
     * @return The operable behind this feature (the feature itself unless aliased)
     */
    Operable operable();

    /**
     * Accepts a feature visitor.
     */
    void accept(FeatureVisitor visitor);
}
