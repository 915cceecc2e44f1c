package org.finos.legend.dsl.sql.ast;

import java.util.Objects;

/**
 * Represents items in the FROM clause.
 *
 * Supports:
 * - Simple table references: FROM table, FROM schema.table
 * - Table aliases: FROM table AS t
 * - Subqueries: FROM (SELECT ...) AS sub
 * - JOINs: FROM a JOIN b ON condition
 */
public sealed interface FromItem extends SQLNode
        permits FromItem.TableRef, FromItem.SubQuery, FromItem.JoinedTable {

    /**
     * Reference to a table: schema.table AS alias
     */
    record TableRef(String schema, String table, String alias) implements FromItem {
        public TableRef {
            Objects.requireNonNull(table, "Table name cannot be null");
        }

        public static TableRef of(String table) {
            return new TableRef(null, table, null);
        }

        public static TableRef of(String table, String alias) {
            return new TableRef(null, table, alias);
        }

        public static TableRef qualified(String schema, String table) {
            return new TableRef(schema, table, null);
        }

        public boolean hasSchema() {
            return schema != null;
        }

        public boolean hasAlias() {
            return alias != null;
        }

        /**
         * Returns the effective name to use in queries (alias if present, otherwise
         * table name).
         */
        public String effectiveName() {
            return alias != null ? alias : table;
        }

        public TableRef as(String newAlias) {
            return new TableRef(schema, table, newAlias);
        }
    }

    /**
     * Subquery in FROM: (SELECT ...) AS alias
     */
    record SubQuery(QueryStatement query, String alias) implements FromItem {
        public SubQuery {
            Objects.requireNonNull(query, "Subquery cannot be null");
            if (alias == null || alias.isBlank()) {
                throw new IllegalArgumentException("Subquery must have an alias");
            }
        }
    }

    /**
     * Joined tables: a JOIN b ON condition
     */
    record JoinedTable(FromItem left, JoinType joinType, FromItem right, Expression condition) implements FromItem {

        public enum JoinType {
            INNER("INNER JOIN"),
            LEFT_OUTER("LEFT OUTER JOIN"),
            FULL_OUTER("FULL OUTER JOIN"),
            CROSS("CROSS JOIN");

            private final String sql;

            JoinType(String sql) {
                this.sql = sql;
            }

            public String toSql() {
                return sql;
            }
        }

        public JoinedTable {
            Objects.requireNonNull(left, "Left item cannot be null");
            Objects.requireNonNull(joinType, "Join type cannot be null");
            Objects.requireNonNull(right, "Right item cannot be null");
        }
    }
}
