package org.finos.legend.dsl.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of parsed symbols awaiting consumption by their parent node.
 *
 * @param <Y> The symbol type
 */
public final class Symbols<Y> {

    private final List<Y> stack = new ArrayList<>();

    /**
     * Pushes a newly parsed symbol.
     */
    public void push(Y symbol) {
        stack.add(symbol);
    }

    /**
     * Removes and returns the top symbol.
     *
     * @throws IllegalStateException if the stack is empty
     */
    public Y pop() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Empty context");
        }
        return stack.remove(stack.size() - 1);
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int size() {
        return stack.size();
    }

    @Override
    public String toString() {
        return stack.toString();
    }
}
