package eu.virtualparadox.priorart.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized corpus document handed over by the ingestion side.
 *
 * @param id       unique, stable identifier (e.g. publication number)
 * @param text     normalized full text, may be empty
 * @param metadata ordered source metadata (title, path, category, ...), copied on construction
 */
public record SourceDocument(String id, String text, Map<String, String> metadata) {

    public SourceDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        Objects.requireNonNull(text, "text cannot be null");

        final Map<String, String> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> copy.put(
                    Objects.requireNonNull(key, "metadata key cannot be null"),
                    Objects.requireNonNull(value, () -> "metadata value for '" + key + "' cannot be null")));
        }
        metadata = Collections.unmodifiableMap(copy);
    }

    public static SourceDocument of(final String id, final String text) {
        return new SourceDocument(id, text, Map.of());
    }
}
