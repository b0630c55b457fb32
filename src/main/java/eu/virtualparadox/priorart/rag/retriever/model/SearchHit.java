package eu.virtualparadox.priorart.rag.retriever.model;

/**
 * @param chunkId Identifier of the matched chunk in the index store.
 * @param score   Cosine similarity between query and chunk vector, in [-1, 1] (higher = better).
 */
public record SearchHit(String chunkId, float score) {

}
