package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.feature.Feature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Source made of two set-combined statements of the same schema.
 *
 * @param left  Left side of the set operation
 * @param right Right side of the set operation
 * @param kind  Set operation type
 */
public record SetOperation(Statement left, Statement right, Kind kind) implements Statement {

    public enum Kind {
        UNION("union"),
        INTERSECTION("intersection"),
        DIFFERENCE("difference");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public SetOperation(Source left, Source right, Kind kind) {
        this(left.statement(), right.statement(), kind);
    }

    public SetOperation {
        Objects.requireNonNull(left, "Left side cannot be null");
        Objects.requireNonNull(right, "Right side cannot be null");
        Objects.requireNonNull(kind, "Set kind cannot be null");
        if (!left.schema().equals(right.schema())) {
            throw new GrammarException("Incompatible sources: " + left + " vs " + right);
        }
    }

    @Override
    public Statement statement() {
        return this;
    }

    @Override
    public List<Feature> features() {
        List<Feature> features = new ArrayList<>(left.features());
        features.addAll(right.features());
        return List.copyOf(features);
    }

    @Override
    public void accept(SourceVisitor visitor) {
        visitor.visitSet(this);
    }

    @Override
    public String toString() {
        return left + " " + kind.value() + " " + right;
    }
}
