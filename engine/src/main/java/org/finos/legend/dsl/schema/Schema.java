package org.finos.legend.dsl.schema;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.frame.Table;
import org.finos.legend.dsl.kind.Kind;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, named collection of fields.
 *
 * Each field is registered under a key. A field defined without a name is
 * renamed to its key, and no two keys (including those inherited from base
 * schemas) may resolve to the same field name.
 *
 * Schema identity is structural: two schemas are equal when they hold the same
 * number of fields and the fields are pairwise equal in the same order. The
 * schema name does not take part in equality.
 */
public final class Schema implements Iterable<Field> {

    private final String name;
    private final Map<String, Field> fields;

    private Schema(String name, LinkedHashMap<String, Field> fields) {
        this.name = Objects.requireNonNull(name, "Schema name cannot be null");
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Starts a schema definition inheriting the fields of the given base schemas.
     *
     * @throws GrammarException if two bases define fields of the same name under different keys
     */
    public static Builder builder(String name, Schema... bases) {
        return new Builder(name, bases);
    }

    /**
     * Creates a schema of the given fields keyed by their names, or by
     * {@code _<index>} for anonymous fields.
     */
    public static Schema of(String name, List<Field> fields) {
        Builder builder = new Builder(name);
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            builder.field(field.name() != null ? field.name() : "_" + i, field);
        }
        return builder.build();
    }

    public String name() {
        return name;
    }

    /**
     * @return Fields in definition order
     */
    public List<Field> fields() {
        return List.copyOf(fields.values());
    }

    /**
     * @return Field keys in definition order
     */
    public List<String> keys() {
        return List.copyOf(fields.keySet());
    }

    public int size() {
        return fields.size();
    }

    /**
     * Looks a field up by its key or, failing that, by its name.
     *
     * @throws IllegalArgumentException if there is no such field
     */
    public Field get(String keyOrName) {
        Field field = fields.get(keyOrName);
        if (field != null) {
            return field;
        }
        for (Field candidate : fields.values()) {
            if (candidate.name().equals(keyOrName)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown field " + keyOrName + " in schema " + name);
    }

    public boolean contains(String keyOrName) {
        return fields.containsKey(keyOrName) || fields.values().stream().anyMatch(f -> f.name().equals(keyOrName));
    }

    /**
     * @return The table source backed by this schema
     */
    public Table table() {
        return new Table(this);
    }

    @Override
    public Iterator<Field> iterator() {
        return fields.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schema other)) {
            return false;
        }
        return fields().equals(other.fields());
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Field field : fields.values()) {
            hash ^= field.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Schema definition builder.
     */
    public static final class Builder {

        private final String name;
        private final LinkedHashMap<String, Field> fields = new LinkedHashMap<>();
        private final Map<String, String> keysByName = new HashMap<>();

        private Builder(String name, Schema... bases) {
            this.name = Objects.requireNonNull(name, "Schema name cannot be null");
            for (Schema base : bases) {
                for (Map.Entry<String, Field> entry : base.fields.entrySet()) {
                    if (fields.containsKey(entry.getKey())) {
                        continue;
                    }
                    if (keysByName.putIfAbsent(entry.getValue().name(), entry.getKey()) != null) {
                        throw new GrammarException("Colliding base schemas in schema " + name);
                    }
                    fields.put(entry.getKey(), entry.getValue());
                }
            }
        }

        public Builder field(String key, Kind kind) {
            return field(key, Field.of(kind));
        }

        public Builder field(String key, Kind kind, String fieldName) {
            return field(key, Field.of(kind, fieldName));
        }

        /**
         * Registers (or overrides) the field under the given key.
         *
         * @throws GrammarException if another key already resolves to the same field name
         */
        public Builder field(String key, Field field) {
            Objects.requireNonNull(key, "Field key cannot be null");
            if (field.name() == null || field.name().isEmpty()) {
                field = field.renamed(key);
            }
            String existing = keysByName.get(field.name());
            if (existing != null && !existing.equals(key)) {
                throw new GrammarException("Colliding field name " + field.name() + " in schema " + name);
            }
            keysByName.put(field.name(), key);
            fields.put(key, field);
            return this;
        }

        public Schema build() {
            return new Schema(name, new LinkedHashMap<>(fields));
        }
    }
}
