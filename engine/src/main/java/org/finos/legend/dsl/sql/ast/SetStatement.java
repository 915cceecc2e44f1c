package org.finos.legend.dsl.sql.ast;

import java.util.Objects;

/**
 * Set operation: left UNION|INTERSECT|EXCEPT right
 */
public record SetStatement(QueryStatement left, SetOperator operator, QueryStatement right)
        implements QueryStatement {

    public enum SetOperator {
        UNION("UNION"),
        INTERSECT("INTERSECT"),
        EXCEPT("EXCEPT");

        private final String sql;

        SetOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }
    }

    public SetStatement {
        Objects.requireNonNull(left, "Left statement cannot be null");
        Objects.requireNonNull(operator, "Set operator cannot be null");
        Objects.requireNonNull(right, "Right statement cannot be null");
    }
}
