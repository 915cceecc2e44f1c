package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.GrammarException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Feature tree decomposition helpers.
 */
public final class Features {

    private Features() {
    }

    /**
     * Collects all instances of the given type found in the feature trees, including the operands,
     * partition and ordering features of windows.
     */
    public static <T> Set<T> dissect(Class<T> type, Collection<? extends Feature> features) {
        Dissect<T> dissect = new Dissect<>(type);
        for (Feature feature : features) {
            feature.accept(dissect);
        }
        return dissect.matches;
    }

    public static <T> Set<T> dissect(Class<T> type, Feature... features) {
        return dissect(type, List.of(features));
    }

    /**
     * Ensures the feature itself is of the given type.
     */
    public static <T extends Feature> T ensureIs(Class<T> type, Feature feature) {
        if (!type.isInstance(feature)) {
            throw new GrammarException(feature + " not an instance of a " + type.getSimpleName());
        }
        return type.cast(feature);
    }

    /**
     * Ensures the feature tree contains an instance of the given type.
     */
    public static <F extends Feature> F ensureIn(Class<?> type, F feature) {
        if (dissect(type, feature).isEmpty()) {
            throw new GrammarException("No " + type.getSimpleName() + " instance(s) found in " + feature);
        }
        return feature;
    }

    /**
     * Ensures the feature tree contains no instance of the given type.
     */
    public static <F extends Feature> F ensureNotIn(Class<?> type, F feature) {
        if (!dissect(type, feature).isEmpty()) {
            throw new GrammarException(type.getSimpleName() + " instance(s) found in " + feature);
        }
        return feature;
    }

    private static final class Dissect<T> implements FeatureVisitor {

        private final Class<T> type;
        private final Set<T> matches = new LinkedHashSet<>();

        private Dissect(Class<T> type) {
            this.type = type;
        }

        @Override
        public void visitFeature(Feature feature) {
            if (type.isInstance(feature)) {
                matches.add(type.cast(feature));
            }
        }

        @Override
        public void visitWindow(Window feature) {
            for (Operable operand : feature.operands()) {
                operand.accept(this);
            }
            visitFeature(feature);
        }
    }
}
