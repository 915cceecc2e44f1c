package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.feature.Operable;

/**
 * Source that can be queried directly. Every operation returns a new query.
 */
public sealed interface Queryable extends Source permits Origin, Query {

    /**
     * Projection. Repeated calls replace the earlier selection.
     */
    default Query select(Feature... features) {
        return query().select(features);
    }

    /**
     * Row filter applied before aggregation. Repeated calls are combined with AND.
     */
    default Query where(Operable condition) {
        return query().where(condition);
    }

    /**
     * Row filter applied to the aggregated rows. Repeated calls are combined with AND.
     */
    default Query having(Operable condition) {
        return query().having(condition);
    }

    /**
     * Aggregation grouping. Repeated calls replace the earlier grouping.
     */
    default Query groupby(Operable... features) {
        return query().groupby(features);
    }

    /**
     * Ordering by features optionally followed by directions, see {@link org.finos.legend.dsl.feature.Ordering#make}.
     * Repeated calls replace the earlier ordering.
     */
    default Query orderby(Object... terms) {
        return query().orderby(terms);
    }

    default Query limit(int count) {
        return query().limit(count, 0);
    }

    default Query limit(int count, int offset) {
        return query().limit(count, offset);
    }
}
