package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.kind.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Window function evaluated over a partition of rows.
 *
 * @param function  The window function
 * @param partition The partitioning features
 * @param ordering  The order in which the rows of a partition are processed
 * @param frame     The sliding frame (null for the default one)
 */
public record Window(Function function, List<Operable> partition, List<Ordering> ordering, Frame frame)
        implements Cumulative {

    /**
     * Function that can be evaluated over a window.
     */
    public sealed interface Function permits Aggregate {

        Kind kind();

        /**
         * @return Function operands in their positional order
         */
        List<Operable> operands();

        /**
         * Creates a window of this function.
         *
         * @param partition The partitioning features
         * @param ordering  Ordering terms as accepted by {@link Ordering#make(Object...)}
         */
        default Window over(List<? extends Operable> partition, Object... ordering) {
            return new Window(this, List.copyOf(partition), Ordering.make(ordering), null);
        }

        default Window over(List<? extends Operable> partition, List<Ordering> ordering, Frame frame) {
            return new Window(this, List.copyOf(partition), ordering, frame);
        }
    }

    /**
     * Sliding frame spec. Bounds are row (or group, or range) offsets relative to
     * the current row: null is unbounded, a negative value is preceding, zero is
     * the current row and a positive value is following.
     */
    public record Frame(Mode mode, Integer start, Integer end) {

        public enum Mode {
            ROWS,
            GROUPS,
            RANGE
        }

        public Frame {
            Objects.requireNonNull(mode, "Frame mode cannot be null");
        }

        @Override
        public String toString() {
            return mode + "(" + start + ", " + end + ")";
        }
    }

    public Window {
        Objects.requireNonNull(function, "Window function cannot be null");
        partition = partition == null ? List.of() : List.copyOf(partition);
        ordering = ordering == null ? List.of() : List.copyOf(ordering);
    }

    @Override
    public Kind kind() {
        return function.kind();
    }

    /**
     * @return The function operands followed by the partition and ordering features
     */
    @Override
    public List<Operable> operands() {
        List<Operable> operands = new ArrayList<>(function.operands());
        operands.addAll(partition);
        ordering.forEach(o -> operands.add(o.feature()));
        return operands;
    }

    @Override
    public void accept(FeatureVisitor visitor) {
        visitor.visitWindow(this);
    }

    @Override
    public String toString() {
        StringBuilder value = new StringBuilder(function + " over(");
        value.append(partition.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")));
        if (!ordering.isEmpty()) {
            value.append(", ").append(ordering.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        if (frame != null) {
            value.append(", ").append(frame);
        }
        return value.append(')').toString();
    }
}
