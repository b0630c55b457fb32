package eu.virtualparadox.priorart.query.model;

import java.util.Optional;

/**
 * A query in one of the two accepted shapes.
 */
public sealed interface RetrievalQuery permits RetrievalQuery.RawText, RetrievalQuery.Structured {

    record RawText(String text) implements RetrievalQuery {
    }

    record Structured(StructuredQueryDocument document) implements RetrievalQuery {
    }

    static RetrievalQuery of(final String text) {
        return new RawText(text);
    }

    static RetrievalQuery of(final StructuredQueryDocument document) {
        return new Structured(document);
    }

    /**
     * Resolves an untyped query object.
     *
     * @return the typed query, or empty for {@code null} and unsupported types
     */
    static Optional<RetrievalQuery> resolve(final Object query) {
        if (query instanceof RetrievalQuery typed) {
            return Optional.of(typed);
        }
        if (query instanceof String text) {
            return Optional.of(new RawText(text));
        }
        if (query instanceof StructuredQueryDocument document) {
            return Optional.of(new Structured(document));
        }
        return Optional.empty();
    }
}
