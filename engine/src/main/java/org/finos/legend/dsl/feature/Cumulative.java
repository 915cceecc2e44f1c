package org.finos.legend.dsl.feature;

/**
 * Expression involving cross-row operations.
 */
public sealed interface Cumulative extends Expression permits Aggregate, Window {
}
