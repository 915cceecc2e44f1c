package org.finos.legend.dsl.feature;

import org.finos.legend.dsl.kind.Kind;

import java.util.Objects;

/**
 * Operable exposed under an explicit name.
 *
 * @param operable The aliased operable
 * @param name     The alias
 */
public record Aliased(Operable operable, String name) implements Feature {

    public Aliased {
        Objects.requireNonNull(operable, "Aliased operable cannot be null");
        Objects.requireNonNull(name, "Alias cannot be null");
    }

    @Override
    public Kind kind() {
        return operable.kind();
    }

    @Override
    public void accept(FeatureVisitor visitor) {
        visitor.visitAliased(this);
    }

    @Override
    public String toString() {
        return name + "=[" + operable + "]";
    }
}
