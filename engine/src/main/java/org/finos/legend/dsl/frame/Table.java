package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.feature.Column;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.schema.Schema;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Schema-bound leaf source. Its features are the columns of its schema.
 *
 * @param schema The table schema
 */
public record Table(Schema schema) implements Origin {

    public Table {
        Objects.requireNonNull(schema, "Table schema cannot be null");
    }

    @Override
    public List<Feature> features() {
        return schema.fields().stream()
                .map(field -> (Feature) new Column(this, field.name()))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return The column of the given field key or name
     */
    public Column column(String name) {
        return (Column) get(name);
    }

    @Override
    public void accept(SourceVisitor visitor) {
        visitor.visitTable(this);
    }

    @Override
    public String toString() {
        return schema.name();
    }
}
