package org.finos.legend.dsl.frame;

import org.finos.legend.dsl.feature.Element;
import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.schema.Schema;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Named wrapper of another source.
 *
 * Its features are elements bound to the reference rather than to the wrapped
 * instance, which makes two references of the same source distinguishable
 * (self-joins, sub-query aliasing). A reference of a reference wraps the
 * innermost instance. Unnamed features of the instance are exposed under
 * their schema keys ({@code _0}, {@code _1}...).
 *
 * @param instance The wrapped source
 * @param name     The reference name (generated when not given)
 */
public record Reference(Source instance, String name) implements Origin {

    private static final int NAME_LENGTH = 8;

    public Reference {
        Objects.requireNonNull(instance, "Referenced instance cannot be null");
        instance = instance.instance();
        if (name == null || name.isEmpty()) {
            name = randomName();
        }
    }

    private static String randomName() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder name = new StringBuilder(NAME_LENGTH);
        for (int i = 0; i < NAME_LENGTH; i++) {
            name.append((char) ('a' + random.nextInt(26)));
        }
        return name.toString();
    }

    @Override
    public List<Feature> features() {
        return instance.schema().fields().stream()
                .map(field -> (Feature) Element.of(this, field.name()))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Schema schema() {
        return instance.schema();
    }

    @Override
    public void accept(SourceVisitor visitor) {
        visitor.visitReference(this);
    }

    @Override
    public String toString() {
        return name + "=[" + instance + "]";
    }
}
