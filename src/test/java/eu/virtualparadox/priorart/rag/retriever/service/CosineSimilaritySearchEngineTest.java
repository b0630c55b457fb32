package eu.virtualparadox.priorart.rag.retriever.service;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.rag.index.Fingerprint;
import eu.virtualparadox.priorart.rag.index.IndexRecord;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.retriever.model.SearchHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilaritySearchEngineTest {

    private static final Fingerprint FP = new Fingerprint("fake:v1", 400, 100);

    private final CosineSimilaritySearchEngine engine = new CosineSimilaritySearchEngine();

    private static IndexRecord record(String chunkId, float... vector) {
        return new IndexRecord(chunkId, chunkId.substring(0, 1), vector, chunkId, Map.of());
    }

    @Test
    @DisplayName("Best match comes first and scores are cosine similarities")
    void ranking() {
        IndexStore store = new IndexStore(FP, List.of(
                record("a", 1f, 0f),
                record("b", 0f, 1f),
                record("c", 1f, 1f)));

        List<SearchHit> hits = engine.search(store, new float[]{1f, 0f}, 3);

        assertEquals(List.of("a", "c", "b"), hits.stream().map(SearchHit::chunkId).toList());
        assertEquals(1.0f, hits.get(0).score(), 1e-6);
        assertEquals((float) (1 / Math.sqrt(2)), hits.get(1).score(), 1e-6);
        assertEquals(0.0f, hits.get(2).score(), 1e-6);
    }

    @Test
    @DisplayName("Equal scores are ordered by ascending chunk id")
    void tieBreak() {
        IndexStore store = new IndexStore(FP, List.of(
                record("c", 1f, 0f),
                record("a", 2f, 0f),
                record("b", 3f, 0f)));

        List<SearchHit> hits = engine.search(store, new float[]{1f, 0f}, 2);

        assertEquals(List.of("a", "b"), hits.stream().map(SearchHit::chunkId).toList());
    }

    @Test
    @DisplayName("Result length is min(k, store size)")
    void topKBound() {
        IndexStore store = new IndexStore(FP, List.of(record("a", 1f), record("b", 1f)));
        assertEquals(2, engine.search(store, new float[]{1f}, 10).size());
        assertEquals(1, engine.search(store, new float[]{1f}, 1).size());
    }

    @Test
    @DisplayName("Zero vectors score 0")
    void zeroVector() {
        IndexStore store = new IndexStore(FP, List.of(record("a", 0f, 0f), record("b", 1f, 0f)));

        List<SearchHit> hits = engine.search(store, new float[]{0f, 0f}, 2);
        assertEquals(0.0f, hits.get(0).score());
        assertEquals(0.0f, hits.get(1).score());
        assertEquals("a", hits.get(0).chunkId());
    }

    @Test
    @DisplayName("Heap selection agrees with a full sort")
    void matchesFullSort() {
        Random rnd = new Random(7);
        List<IndexRecord> records = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            // coarse values produce many ties
            records.add(record(String.format(Locale.ROOT, "r%04d", i), rnd.nextInt(3) - 1, rnd.nextInt(3) - 1, rnd.nextInt(3) - 1));
        }
        IndexStore store = new IndexStore(FP, records);
        float[] query = {1f, -1f, 0f};

        List<SearchHit> expected = store.records().stream()
                .map(r -> engine.search(new IndexStore(FP, List.of(r)), query, 1).get(0))
                .sorted(CosineSimilaritySearchEngine.RANKING)
                .limit(25)
                .toList();

        assertEquals(expected, engine.search(store, query, 25));
    }

    @Test
    @DisplayName("Empty store returns no hits, invalid k and dimension are rejected")
    void edgeCases() {
        assertTrue(engine.search(IndexStore.empty(FP), new float[]{1f}, 5).isEmpty());

        IndexStore store = new IndexStore(FP, List.of(record("a", 1f, 0f)));
        assertThrows(ConfigurationException.class, () -> engine.search(store, new float[]{1f, 0f}, 0));
        assertThrows(IllegalArgumentException.class, () -> engine.search(store, new float[]{1f, 0f, 0f}, 1));
    }

    @Test
    @DisplayName("Ranking comparator puts higher scores first")
    void comparator() {
        List<SearchHit> hits = new ArrayList<>(List.of(new SearchHit("b", 0.5f), new SearchHit("a", 0.5f), new SearchHit("c", 0.9f)));
        hits.sort(CosineSimilaritySearchEngine.RANKING);
        assertEquals(List.of("c", "a", "b"), hits.stream().map(SearchHit::chunkId).toList());
    }
}
