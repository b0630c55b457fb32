package eu.virtualparadox.priorart.query.model;

import eu.virtualparadox.priorart.ingest.chunker.Chunker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * One ranked match, produced per query and never persisted.
 *
 * @param rank     1-based position in the result list
 * @param chunkId  matched chunk
 * @param sourceId source document of the chunk
 * @param score    cosine similarity to the query
 * @param text     chunk text
 * @param metadata source metadata plus {@code startOffset}
 */
public record RetrievalResult(int rank,
                              String chunkId,
                              String sourceId,
                              float score,
                              String text,
                              Map<String, String> metadata) {

    public RetrievalResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Start offset of the chunk in its source text, read from the provenance metadata.
     */
    public OptionalInt startOffset() {
        final String value = metadata.get(Chunker.START_OFFSET_KEY);
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value));
        } catch (final NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
