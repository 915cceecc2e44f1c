package org.finos.legend.dsl.feed;

import org.finos.legend.dsl.feature.Feature;
import org.finos.legend.dsl.frame.Source;
import org.finos.legend.dsl.parser.Visitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Base class for feed readers.
 *
 * A reader compiles a source using its parser (configured with the reader's
 * source and feature mappings), executes the compiled statement and formats the
 * native result into the column-major layout.
 *
 * @param <S> The source symbol type of the parser
 * @param <F> The feature symbol type of the parser
 * @param <R> The native result type
 */
public abstract class Reader<S, F, R> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Reader.class);

    private final Map<Source, S> sources;
    private final Map<Feature, F> features;

    protected Reader(Map<? extends Source, ? extends S> sources, Map<? extends Feature, ? extends F> features) {
        this.sources = Map.copyOf(sources);
        this.features = Map.copyOf(features);
    }

    /**
     * Reads the given source.
     *
     * @return The result columns
     */
    public List<List<Object>> apply(Source source) {
        LOGGER.debug("Parsing {}", source);
        S statement = parser(sources, features).parse(source);
        LOGGER.debug("Starting read using: {}", statement);
        return format(read(statement));
    }

    /**
     * @return A fresh parser instance using the given mappings
     */
    protected abstract Visitor<S, F> parser(Map<Source, S> sources, Map<Feature, F> features);

    /**
     * Executes the statement in the reader's native syntax.
     */
    protected abstract R read(S statement);

    /**
     * Converts the native result into a list of columns.
     */
    protected abstract List<List<Object>> format(R data);
}
