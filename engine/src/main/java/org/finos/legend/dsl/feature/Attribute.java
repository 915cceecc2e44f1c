package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.frame.Origin;

import java.util.Objects;

/**
 * Field of a non-table origin (a reference or a join).
 *
 * @param origin The owning origin
 * @param name   The field name
 */
public record Attribute(Origin origin, String name) implements Element {

    public Attribute {
        Objects.requireNonNull(origin, "Attribute origin cannot be null");
        Objects.requireNonNull(name, "Attribute name cannot be null");
    }

    @Override
    public String toString() {
        return origin + "." + name;
    }
}
