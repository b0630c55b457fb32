package eu.virtualparadox.priorart.rag.retriever.service;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.rag.index.IndexRecord;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.retriever.model.SearchHit;
import eu.virtualparadox.priorart.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact top-k search by cosine similarity over every record of the store.
 * <p>
 * Steps:
 * <ol>
 *   <li>Score each record against the query vector</li>
 *   <li>Keep the best {@code k} in a bounded min-heap (worst hit on top)</li>
 *   <li>Drain the heap and return the hits best first</li>
 * </ol>
 * Equal scores are ordered by ascending chunk id, so the output is fully deterministic.
 */
@Service
@Slf4j
public final class CosineSimilaritySearchEngine implements SimilaritySearchEngine {

    /**
     * Best hit first: score descending, then chunk id ascending.
     */
    static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparing(SearchHit::chunkId);

    @Override
    public List<SearchHit> search(final IndexStore store, final float[] queryVector, final int k) {
        if (k <= 0) {
            throw new ConfigurationException("k must be positive, got " + k);
        }
        if (store.isEmpty()) {
            return List.of();
        }
        if (queryVector == null || queryVector.length != store.dimension()) {
            throw new IllegalArgumentException("Query vector dimension "
                    + (queryVector == null ? "null" : queryVector.length)
                    + " does not match store dimension " + store.dimension());
        }

        // reversed ranking: the head is the weakest hit kept so far
        final PriorityQueue<SearchHit> heap = new PriorityQueue<>(Math.min(k, store.size()) + 1, RANKING.reversed());
        for (final IndexRecord record : store.records()) {
            final SearchHit hit = new SearchHit(record.chunkId(), (float) VectorMath.cosine(queryVector, record.vector()));
            if (heap.size() < k) {
                heap.add(hit);
            } else if (RANKING.compare(hit, heap.peek()) < 0) {
                heap.poll();
                heap.add(hit);
            }
        }

        final List<SearchHit> hits = new ArrayList<>(heap);
        hits.sort(RANKING);
        log.debug("Scanned {} records, returning {} hits", store.size(), hits.size());
        return hits;
    }
}
