package org.finos.legend.dsl.frame;

/**
 * Visitor over the source tree.
 *
 * The default methods traverse children first and then call
 * {@link #visitSource(Source)} on the node itself.
 */
public interface SourceVisitor {

    /**
     * Generic hook called for every visited source.
     */
    default void visitSource(Source source) {
    }

    default void visitTable(Table table) {
        visitSource(table);
    }

    default void visitReference(Reference reference) {
        reference.instance().accept(this);
        visitSource(reference);
    }

    default void visitJoin(Join join) {
        join.left().accept(this);
        join.right().accept(this);
        visitSource(join);
    }

    default void visitSet(SetOperation set) {
        set.left().accept(this);
        set.right().accept(this);
        visitSource(set);
    }

    default void visitQuery(Query query) {
        query.source().accept(this);
        visitSource(query);
    }
}
