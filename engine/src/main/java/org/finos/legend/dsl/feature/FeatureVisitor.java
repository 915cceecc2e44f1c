package org.finos.legend.dsl.feature;

/**
 * Visitor over the feature tree.
 *
 * The default methods visit the operands first and then call
 * {@link #visitFeature(Feature)} on the node itself. Windows are not descended into.
 */
public interface FeatureVisitor {

    /**
     * Generic hook called for every visited feature.
     */
    default void visitFeature(Feature feature) {
    }

    default void visitAliased(Aliased feature) {
        feature.operable().accept(this);
        visitFeature(feature);
    }

    default void visitElement(Element feature) {
        visitFeature(feature);
    }

    default void visitLiteral(Literal feature) {
        visitFeature(feature);
    }

    default void visitExpression(Expression feature) {
        for (Operable operand : feature.operands()) {
            operand.accept(this);
        }
        visitFeature(feature);
    }

    default void visitWindow(Window feature) {
        visitFeature(feature);
    }
}
