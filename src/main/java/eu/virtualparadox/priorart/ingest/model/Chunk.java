package eu.virtualparadox.priorart.ingest.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable window of a source document's text.
 * <p>Carries the source id and start offset so a match can be traced back to its origin.
 * {@code metadata} is the source metadata plus the {@code startOffset} entry.</p>
 */
public record Chunk(String sourceId, int startOffset, String text, Map<String, String> metadata) {

    public Chunk {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String chunkId() {
        return buildChunkId(sourceId, startOffset);
    }

    /**
     * Builds a stable chunk identifier:
     * <pre>
     *   {sourceId}_{startOffset(8 digits)}
     * </pre>
     * Zero padding keeps the ids of one source in offset order when sorted as strings.
     * ASCII digits regardless of the default locale.
     */
    public static String buildChunkId(final String sourceId, final int startOffset) {
        return sourceId + "_" + StringUtils.leftPad(Integer.toString(startOffset), 8, '0');
    }
}
