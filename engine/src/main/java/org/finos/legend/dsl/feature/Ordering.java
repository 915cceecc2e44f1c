package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ordering spec: a feature and its direction.
 *
 * @param feature   The ordering feature
 * @param direction The ordering direction
 */
public record Ordering(Operable feature, Direction direction) {

    public enum Direction {
        ASCENDING("ascending"),
        DESCENDING("descending");

        private final String value;

        Direction(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        /**
         * Parses a direction token ({@code asc}, {@code ascending}, {@code desc}
         * or {@code descending}, case-insensitively).
         *
         * @throws GrammarException for any other token
         */
        public static Direction of(Object token) {
            if (token instanceof Direction direction) {
                return direction;
            }
            if (token instanceof String text) {
                switch (text.toLowerCase(Locale.ROOT)) {
                    case "asc", "ascending":
                        return ASCENDING;
                    case "desc", "descending":
                        return DESCENDING;
                    default:
                        break;
                }
            }
            throw new GrammarException("Invalid ordering direction " + token);
        }

        /**
         * @return Ordering of the given feature in this direction
         */
        public Ordering apply(Feature feature) {
            return new Ordering(feature.operable(), this);
        }

        @Override
        public String toString() {
            return "<" + value + ">";
        }
    }

    public Ordering {
        Objects.requireNonNull(feature, "Ordering feature cannot be null");
        if (direction == null) {
            direction = Direction.ASCENDING;
        }
    }

    public Ordering(Operable feature) {
        this(feature, Direction.ASCENDING);
    }

    /**
     * Normalizes a flat sequence of ordering terms.
     *
     * A feature immediately followed by a direction (or a direction token) is
     * ordered that way, a feature on its own ascending. Orderings and two-element
     * (feature, direction) pairs given as lists or map entries are accepted too.
     *
     * @throws GrammarException for any other term
     */
    public static List<Ordering> make(Object... terms) {
        List<Ordering> orderings = new ArrayList<>();
        for (int i = 0; i < terms.length; i++) {
            Object term = terms[i];
            if (term instanceof Feature feature) {
                Object next = i + 1 < terms.length ? terms[i + 1] : null;
                if (next instanceof Direction || next instanceof String) {
                    orderings.add(Direction.of(next).apply(feature));
                    i++;
                } else {
                    orderings.add(new Ordering(feature.operable()));
                }
            } else if (term instanceof Ordering ordering) {
                orderings.add(ordering);
            } else if (term instanceof List<?> pair && pair.size() == 2 && pair.get(0) instanceof Feature feature) {
                orderings.add(Direction.of(pair.get(1)).apply(feature));
            } else if (term instanceof Map.Entry<?, ?> pair && pair.getKey() instanceof Feature feature) {
                orderings.add(Direction.of(pair.getValue()).apply(feature));
            } else {
                throw new GrammarException("Expecting pair of feature and direction");
            }
        }
        return List.copyOf(orderings);
    }

    @Override
    public String toString() {
        return String.valueOf(feature) + direction;
    }
}
