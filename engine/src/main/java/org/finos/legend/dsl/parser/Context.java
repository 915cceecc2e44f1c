package org.finos.legend.dsl.parser;

import org.finos.legend.dsl.frame.Origin;

import java.util.HashMap;
import java.util.Map;

/**
 * Parsing state of a single scope.
 *
 * @param <Y> The symbol type
 */
public final class Context<Y> {

    private final Symbols<Y> symbols = new Symbols<>();
    private final Tables tables = new Tables();
    private final Map<Origin, Y> origins = new HashMap<>();

    public Symbols<Y> symbols() {
        return symbols;
    }

    public Tables tables() {
        return tables;
    }

    /**
     * @return Backend handles of the origins visited in this scope
     */
    public Map<Origin, Y> origins() {
        return origins;
    }

    /**
     * A context is dirty while it still holds unconsumed symbols and as such cannot be closed.
     */
    public boolean isDirty() {
        return !symbols.isEmpty();
    }
}
