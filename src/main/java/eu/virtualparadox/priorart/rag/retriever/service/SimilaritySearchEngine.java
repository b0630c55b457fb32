package eu.virtualparadox.priorart.rag.retriever.service;

import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.retriever.model.SearchHit;

import java.util.List;

public interface SimilaritySearchEngine {

    /**
     * @param store       store to search
     * @param queryVector embedded query, same dimension as the store
     * @param k           maximum number of hits, must be positive
     * @return at most {@code k} hits, best first; ties ordered by ascending chunk id
     */
    List<SearchHit> search(final IndexStore store, final float[] queryVector, final int k);

}
