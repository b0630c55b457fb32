package eu.virtualparadox.priorart.rag.index;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One embedded chunk as held by an {@link IndexStore}.
 * <p>The vector is copied in and out, so a record can never change after construction.</p>
 *
 * @param chunkId  deterministic id derived from source id and start offset
 * @param sourceId id of the originating source document
 * @param vector   embedding of {@code text}
 * @param text     chunk text
 * @param metadata source metadata plus {@code startOffset}, in insertion order
 */
public record IndexRecord(String chunkId, String sourceId, float[] vector, String text, Map<String, String> metadata) {

    public IndexRecord {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(text, "text");
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector of " + chunkId + " must not be null or empty");
        }
        vector = vector.clone();
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimension() {
        return vector.length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexRecord other)) return false;
        return chunkId.equals(other.chunkId)
                && sourceId.equals(other.sourceId)
                && Arrays.equals(vector, other.vector)
                && text.equals(other.text)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkId, sourceId, Arrays.hashCode(vector), text, metadata);
    }

    @Override
    public String toString() {
        return "IndexRecord[chunkId=" + chunkId + ", sourceId=" + sourceId + ", dim=" + vector.length
                + ", text=" + text.length() + " chars, metadata=" + metadata + "]";
    }
}
