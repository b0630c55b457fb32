package eu.virtualparadox.priorart.query.model;

import eu.virtualparadox.priorart.rag.embed.Embedder;
import eu.virtualparadox.priorart.rag.index.IndexStore;

import java.util.Objects;

/**
 * What a single retrieval runs against: the store snapshot taken when the query arrived
 * and the embedder that has to match the store's fingerprint.
 */
public record RetrievalContext(IndexStore store, Embedder embedder) {

    public RetrievalContext {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(embedder, "embedder");
    }
}
