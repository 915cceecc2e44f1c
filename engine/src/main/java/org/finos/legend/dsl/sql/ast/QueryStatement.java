package org.finos.legend.dsl.sql.ast;

/**
 * Complete row-producing statement: a SELECT or a set operation of two statements.
 */
public sealed interface QueryStatement extends SQLNode permits SelectStatement, SetStatement {
}
