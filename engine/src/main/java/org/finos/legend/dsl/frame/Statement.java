package org.finos.legend.dsl.frame;

/**
 * Complete statement: a query or a set combination of statements.
 */
public sealed interface Statement extends Source permits Query, SetOperation {
}
