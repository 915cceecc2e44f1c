package org.finos.legend.dsl.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Base parser structure holding a stack of scoped contexts.
 *
 * A scope opened by {@link #enter()} gets its own fresh context which is checked
 * for total depletion when the scope closes:
 *
 * <pre>
 * try (Container.Scope scope = container.enter()) {
 *     source.accept(container);
 *     return container.fetch();
 * }
 * </pre>
 *
 * @param <Y> The symbol type
 */
public abstract class Container<Y> {

    private Context<Y> context;
    private final List<Context<Y>> stack = new ArrayList<>();

    /**
     * @return The current context
     * @throws IllegalStateException outside of any scope or after a fetch
     */
    public Context<Y> context() {
        if (context == null) {
            throw new IllegalStateException("Invalid context");
        }
        return context;
    }

    /**
     * Opens a nested scope with a fresh context.
     */
    public Scope enter() {
        stack.add(context);
        context = new Context<>();
        return new Scope();
    }

    /**
     * Retrieves the last symbol of the current context. Must be called exactly
     * once when there is a single symbol pending. A successful fetch kills the context.
     *
     * @throws IllegalStateException if more symbols remain
     */
    public Y fetch() {
        Y symbol = context().symbols().pop();
        if (context.isDirty()) {
            throw new IllegalStateException("Premature fetch");
        }
        context = null;
        return symbol;
    }

    /**
     * Scope handle restoring the previous context on close.
     */
    public final class Scope implements AutoCloseable {

        private Scope() {
        }

        /**
         * @throws IllegalStateException if the context still holds unconsumed symbols
         */
        @Override
        public void close() {
            if (context != null && context.isDirty()) {
                throw new IllegalStateException("Context not fetched");
            }
            context = stack.remove(stack.size() - 1);
        }
    }
}
