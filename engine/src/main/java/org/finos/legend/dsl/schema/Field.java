package org.finos.legend.dsl.schema;

import org.finos.legend.dsl.kind.Kind;

import java.util.Objects;

/**
 * Schema field: a kind with an optional name.
 *
 * A field defined without a name takes the name of the key it is registered
 * under when its schema is built.
 *
 * @param kind The field kind
 * @param name The field name (may be null until the schema is built)
 */
public record Field(Kind kind, String name) {

    public Field {
        Objects.requireNonNull(kind, "Field kind cannot be null");
    }

    public static Field of(Kind kind) {
        return new Field(kind, null);
    }

    public static Field of(Kind kind, String name) {
        return new Field(kind, name);
    }

    /**
     * @return Copy of this field with a different name
     */
    public Field renamed(String newName) {
        return new Field(kind, newName);
    }

    @Override
    public String toString() {
        return name + ":" + kind;
    }
}
