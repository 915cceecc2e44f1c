package org.finos.legend.dsl.sql.ast;

import java.util.List;
import java.util.Objects;

/**
 * Represents a SQL SELECT statement.
 *
 * @param selectItems The projection list (may contain * for all columns)
 * @param from        The FROM clause item
 * @param where       Optional WHERE condition
 * @param groupBy     Optional GROUP BY columns
 * @param having      Optional HAVING condition
 * @param orderBy     Optional ORDER BY specifications
 * @param limit       Optional LIMIT value
 * @param offset      Optional OFFSET value
 */
public record SelectStatement(
        List<SelectItem> selectItems,
        FromItem from,
        Expression where,
        List<Expression> groupBy,
        Expression having,
        List<OrderSpec> orderBy,
        Integer limit,
        Integer offset) implements QueryStatement {

    public SelectStatement {
        selectItems = List.copyOf(selectItems);
        Objects.requireNonNull(from, "FROM item cannot be null");
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    /**
     * Creates a simple SELECT statement with just projections and FROM.
     */
    public static SelectStatement simple(List<SelectItem> items, FromItem from) {
        return new SelectStatement(items, from, null, List.of(), null, List.of(), null, null);
    }

    /**
     * Creates SELECT * FROM the given item.
     */
    public static SelectStatement all(FromItem from) {
        return simple(List.of(SelectItem.AllColumns.unqualified()), from);
    }

    public boolean hasWhere() {
        return where != null;
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    public boolean hasHaving() {
        return having != null;
    }

    public boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    public boolean hasLimit() {
        return limit != null;
    }
}
