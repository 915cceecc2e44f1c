package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.frame.Origin;
import org.finos.legend.dsl.frame.Table;
import org.finos.legend.dsl.kind.Kind;

/**
 * Named field of an origin. Elements of a table are {@link Column}s.
 */
public sealed interface Element extends Operable permits Column, Attribute {

    /**
     * Creates the element of the given origin: a column for a table, an attribute otherwise.
     */
    static Element of(Origin origin, String name) {
        if (origin instanceof Table table) {
            return new Column(table, name);
        }
        return new Attribute(origin, name);
    }

    /**
     * @return The origin this element belongs to
     */
    Origin origin();

    @Override
    default Kind kind() {
        return origin().schema().get(name()).kind();
    }

    @Override
    default void accept(FeatureVisitor visitor) {
        visitor.visitElement(this);
    }
}
