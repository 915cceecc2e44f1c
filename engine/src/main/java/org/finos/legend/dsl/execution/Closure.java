package org.finos.legend.dsl.execution;

/**
 * Deferred computation over an input table.
 *
 * @param <I> The input type
 * @param <O> The output type
 */
@FunctionalInterface
public interface Closure<I, O> {

    O apply(I input);
}
