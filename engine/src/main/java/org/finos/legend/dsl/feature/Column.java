package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.frame.Table;

import java.util.Objects;

/**
 * Field of a table.
 *
 * @param origin The owning table
 * @param name   The field name
 */
public record Column(Table origin, String name) implements Element {

    public Column {
        Objects.requireNonNull(origin, "Column table cannot be null");
        Objects.requireNonNull(name, "Column name cannot be null");
    }

    @Override
    public String toString() {
        return origin + "." + name;
    }
}
