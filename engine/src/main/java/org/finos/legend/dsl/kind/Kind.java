package org.finos.legend.dsl.kind;

import org.finos.legend.dsl.CastException;
import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.UnsupportedException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Value type descriptor of the DSL.
 *
 * Primitive kinds are enum constants (hence process-wide singletons compared by
 * identity), compound kinds are records compared structurally by their
 * parameters.
 *
 * Every kind carries a rank (relative size) used to pick the widest kind of
 * mixed arithmetic operands.
 */
public sealed interface Kind permits Kind.Primitive, Kind.Array, Kind.Map, Kind.Struct {

    /**
     * @return Relative size of this kind
     */
    int rank();

    /**
     * Converts a native value into a value of this kind.
     *
     * @param value The native value (null passes through)
     * @return The converted value
     * @throws CastException if the value cannot be converted
     */
    Object cast(Object value);

    /**
     * Exact type test: is the other kind this kind (or one of its subkinds)?
     */
    default boolean match(Kind other) {
        return equals(other);
    }

    /**
     * Returns the other kind if it matches this one, fails otherwise.
     */
    default Kind ensure(Kind other) {
        if (!match(other)) {
            throw new GrammarException(other + " not an instance of a " + this);
        }
        return other;
    }

    default boolean isNumeric() {
        return false;
    }

    default boolean isPrimitive() {
        return this instanceof Primitive;
    }

    default boolean isCompound() {
        return !isPrimitive();
    }

    /**
     * Fails unless the given kind is numeric.
     */
    static Kind ensureNumeric(Kind kind) {
        if (!kind.isNumeric()) {
            throw new GrammarException(kind + " not an instance of a Numeric");
        }
        return kind;
    }

    /**
     * Infers the kind of a native value.
     *
     * Scalars resolve to their primitive kind, a non-empty list to an array of
     * its first element kind and a non-empty map to either a map (homogeneous
     * keys and values) or a struct (string keys, heterogeneous values).
     *
     * @throws IllegalArgumentException for empty containers or values of no known kind
     */
    static Kind reflect(Object value) {
        for (Primitive primitive : Primitive.BY_RANK) {
            if (primitive.accepts(value)) {
                return primitive;
            }
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            return new Array(reflect(list.get(0)));
        }
        if (value instanceof java.util.Map<?, ?> map && !map.isEmpty()) {
            if (same(map.keySet())) {
                Kind key = reflect(map.keySet().iterator().next());
                if (same(map.values())) {
                    return new Map(key, reflect(map.values().iterator().next()));
                }
                if (key == Primitive.STRING) {
                    List<Struct.Element> elements = new ArrayList<>();
                    map.forEach((k, v) -> elements.add(new Struct.Element((String) k, reflect(v))));
                    return new Struct(elements);
                }
            }
        }
        throw new IllegalArgumentException("Value " + value + " is of unknown kind");
    }

    private static boolean same(Collection<?> values) {
        Class<?> first = values.iterator().next().getClass();
        return values.stream().allMatch(first::isInstance);
    }

    // ==================== Primitive Kinds ====================

    enum Primitive implements Kind {
        BOOLEAN(0, "Boolean"),
        INTEGER(1, "Integer"),
        FLOAT(2, "Float"),
        DECIMAL(1, "Decimal"),
        STRING(1, "String"),
        DATE(2, "Date"),
        TIMESTAMP(1, "Timestamp");

        private static final List<Primitive> BY_RANK = java.util.Arrays.stream(values())
                .sorted(Comparator.comparingInt(Primitive::rank))
                .collect(Collectors.toUnmodifiableList());

        static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
                .appendPattern("yyyy-MM-dd[ ]['T']HH:mm:ss")
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                .optionalEnd()
                .toFormatter();

        private final int rank;
        private final String displayName;

        Primitive(int rank, String displayName) {
            this.rank = rank;
            this.displayName = displayName;
        }

        @Override
        public int rank() {
            return rank;
        }

        @Override
        public boolean isNumeric() {
            return this == INTEGER || this == FLOAT || this == DECIMAL;
        }

        @Override
        public boolean match(Kind other) {
            return this == other || (this == DATE && other == TIMESTAMP);
        }

        boolean accepts(Object value) {
            return switch (this) {
                case BOOLEAN -> value instanceof Boolean;
                case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                        || value instanceof Byte || value instanceof BigInteger;
                case FLOAT -> value instanceof Double || value instanceof Float;
                case DECIMAL -> value instanceof BigDecimal;
                case STRING -> value instanceof String;
                case DATE -> value instanceof LocalDate;
                case TIMESTAMP -> value instanceof LocalDateTime;
            };
        }

        @Override
        public Object cast(Object value) {
            if (value == null) {
                return null;
            }
            try {
                return switch (this) {
                    case BOOLEAN -> toBoolean(value);
                    case INTEGER -> toInteger(value);
                    case FLOAT -> value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString().trim());
                    case DECIMAL -> value instanceof BigDecimal d ? d : new BigDecimal(value.toString().trim());
                    case STRING -> value.toString();
                    case DATE -> toDate(value);
                    case TIMESTAMP -> toTimestamp(value);
                };
            } catch (NumberFormatException | DateTimeParseException e) {
                throw new CastException("Cannot cast " + value + " to " + this, e);
            }
        }

        private Object toBoolean(Object value) {
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof Number n) {
                return n.doubleValue() != 0;
            }
            String text = value.toString().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
            throw new CastException("Cannot cast " + value + " to " + this);
        }

        private Object toInteger(Object value) {
            if (value instanceof BigInteger) {
                return value;
            }
            if (value instanceof Boolean b) {
                return b ? 1L : 0L;
            }
            if (value instanceof Number n) {
                return n.longValue();
            }
            return Long.parseLong(value.toString().trim());
        }

        private Object toDate(Object value) {
            if (value instanceof LocalDate) {
                return value;
            }
            if (value instanceof LocalDateTime timestamp) {
                return timestamp.toLocalDate();
            }
            if (value instanceof String text) {
                return LocalDate.parse(text.trim());
            }
            throw new CastException("Cannot cast " + value + " to " + this);
        }

        private Object toTimestamp(Object value) {
            if (value instanceof LocalDateTime) {
                return value;
            }
            if (value instanceof LocalDate date) {
                return date.atStartOfDay();
            }
            if (value instanceof String text) {
                return LocalDateTime.parse(text.trim(), TIMESTAMP_FORMAT);
            }
            throw new CastException("Cannot cast " + value + " to " + this);
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    // ==================== Compound Kinds ====================

    /**
     * Homogeneous sequence of elements.
     */
    record Array(Kind element) implements Kind {
        public Array {
            Objects.requireNonNull(element, "Array element kind cannot be null");
        }

        @Override
        public int rank() {
            return 1;
        }

        @Override
        public Object cast(Object value) {
            throw new UnsupportedException("Casting to compound kind " + this + " not supported");
        }

        @Override
        public String toString() {
            return "array<" + element + ">";
        }
    }

    /**
     * Key-value mapping with homogeneous keys and values.
     */
    record Map(Kind key, Kind value) implements Kind {
        public Map {
            Objects.requireNonNull(key, "Map key kind cannot be null");
            Objects.requireNonNull(value, "Map value kind cannot be null");
        }

        @Override
        public int rank() {
            return 2;
        }

        @Override
        public Object cast(Object value) {
            throw new UnsupportedException("Casting to compound kind " + this + " not supported");
        }

        @Override
        public String toString() {
            return "map<" + key + ", " + value + ">";
        }
    }

    /**
     * Ordered set of named elements of arbitrary kinds.
     */
    record Struct(List<Element> elements) implements Kind {

        public record Element(String name, Kind kind) {
            public Element {
                Objects.requireNonNull(name, "Struct element name cannot be null");
                Objects.requireNonNull(kind, "Struct element kind cannot be null");
            }

            @Override
            public String toString() {
                return name + ":" + kind;
            }
        }

        public Struct {
            elements = List.copyOf(elements);
            java.util.Set<String> seen = new HashSet<>();
            for (Element element : elements) {
                if (!seen.add(element.name())) {
                    throw new GrammarException("Duplicate struct element: " + element.name());
                }
            }
        }

        /**
         * Creates a struct from name-kind pairs in their iteration order.
         */
        public static Struct of(java.util.Map<String, Kind> elements) {
            List<Element> list = new ArrayList<>();
            new LinkedHashMap<>(elements).forEach((name, kind) -> list.add(new Element(name, kind)));
            return new Struct(list);
        }

        @Override
        public int rank() {
            return elements.size();
        }

        @Override
        public Object cast(Object value) {
            throw new UnsupportedException("Casting to compound kind " + this + " not supported");
        }

        @Override
        public String toString() {
            return elements.stream().map(Element::toString).collect(Collectors.joining(", ", "struct<", ">"));
        }
    }
}
