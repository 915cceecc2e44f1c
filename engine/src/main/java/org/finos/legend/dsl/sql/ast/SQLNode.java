package org.finos.legend.dsl.sql.ast;

/**
 * Base sealed interface for all SQL AST nodes.
 *
 * The AST is the typed compilation target of a frame source, rendered to text
 * by {@link org.finos.legend.dsl.sql.SQLRenderer}.
 */
public sealed interface SQLNode
        permits QueryStatement, Expression, SelectItem, FromItem, OrderSpec {
}
