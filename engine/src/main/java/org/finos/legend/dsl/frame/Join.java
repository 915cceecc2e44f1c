package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.feature.Cumulative;
import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Features;
import org.finos.legend.dsl.feature.Operable;
import org.finos.legend.dsl.feature.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Source made of two join-combined origins.
 *
 * A cross join takes no condition, any other kind requires one. The condition
 * must be a boolean predicate free of cumulative expressions, referring only to
 * features of the two sides.
 *
 * @param left      Left side of the join
 * @param right     Right side of the join
 * @param kind      Join type
 * @param condition Join condition (null for a cross join)
 */
public record Join(Origin left, Origin right, Kind kind, Operable condition) implements Origin {

    public enum Kind {
        INNER("inner"),
        LEFT("left"),
        RIGHT("right"),
        FULL("full"),
        CROSS("cross");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        @Override
        public String toString() {
            return "<" + value + "-join>";
        }
    }

    public Join {
        Objects.requireNonNull(left, "Left side cannot be null");
        Objects.requireNonNull(right, "Right side cannot be null");
        Objects.requireNonNull(kind, "Join kind cannot be null");
        if ((kind == Kind.CROSS) ^ (condition == null)) {
            throw new GrammarException("Illegal use of condition and join type");
        }
        if (condition != null) {
            condition = Features.ensureNotIn(Cumulative.class, Predicate.ensureIs(condition));
            List<Feature> sides = new ArrayList<>(left.features());
            sides.addAll(right.features());
            if (!Features.dissect(Element.class, sides).containsAll(Features.dissect(Element.class, condition))) {
                throw new GrammarException("(" + condition + ") not a subset of source features ("
                        + left.features() + ", " + right.features() + ")");
            }
        }
    }

    @Override
    public List<Feature> features() {
        List<Feature> features = new ArrayList<>(left.features());
        features.addAll(right.features());
        return List.copyOf(features);
    }

    @Override
    public void accept(SourceVisitor visitor) {
        visitor.visitJoin(this);
    }

    @Override
    public String toString() {
        return String.valueOf(left) + kind + right;
    }
}
