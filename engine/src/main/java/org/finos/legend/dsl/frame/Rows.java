package org.finos.legend.dsl.frame;

/**
 * Row limit: at most {@code count} rows after skipping {@code offset}.
 */
public record Rows(int count, int offset) {

    public Rows {
        if (count < 0 || offset < 0) {
            throw new IllegalArgumentException("Invalid row limit " + offset + ":" + count);
        }
    }

    public Rows(int count) {
        this(count, 0);
    }

    @Override
    public String toString() {
        return offset + ":" + count;
    }
}
