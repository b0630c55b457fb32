package eu.virtualparadox.priorart.query;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.ingest.model.Chunk;
import eu.virtualparadox.priorart.query.model.FailureReason;
import eu.virtualparadox.priorart.query.model.RetrievalContext;
import eu.virtualparadox.priorart.query.model.RetrievalOutcome;
import eu.virtualparadox.priorart.query.model.RetrievalResult;
import eu.virtualparadox.priorart.query.model.StructuredQueryDocument;
import eu.virtualparadox.priorart.rag.index.Fingerprint;
import eu.virtualparadox.priorart.rag.index.IndexRecord;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.retriever.service.CosineSimilaritySearchEngine;
import eu.virtualparadox.priorart.support.TestEmbedders;
import eu.virtualparadox.priorart.support.TestEmbedders.FakeEmbedder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static eu.virtualparadox.priorart.support.TestEmbedders.vec;
import static org.junit.jupiter.api.Assertions.*;

class RetrievalOrchestratorTest {

    private static final Fingerprint FP = new Fingerprint("fake:v1", 400, 100);

    private final RetrievalOrchestrator orchestrator = new RetrievalOrchestrator(
            new QueryComposer(), TestEmbedders.callGuard(Duration.ofMillis(500), 3), new CosineSimilaritySearchEngine());

    private static IndexRecord record(String sourceId, int offset, float... vector) {
        String chunkId = Chunk.buildChunkId(sourceId, offset);
        return new IndexRecord(chunkId, sourceId, vector, "text " + chunkId,
                Map.of("title", "Title " + sourceId, "startOffset", Integer.toString(offset)));
    }

    private static IndexStore fiveRecords() {
        return new IndexStore(FP, List.of(
                record("A", 0, 1f, 0f),
                record("A", 300, 0.8f, 0.2f),
                record("B", 0, 0.5f, 0.5f),
                record("C", 0, 0f, 1f),
                record("D", 0, -1f, 0f)));
    }

    private static List<RetrievalResult> results(RetrievalOutcome outcome) {
        return assertInstanceOf(RetrievalOutcome.Success.class, outcome).results();
    }

    private static FailureReason reason(RetrievalOutcome outcome) {
        return assertInstanceOf(RetrievalOutcome.Failure.class, outcome).reason();
    }

    @Test
    @DisplayName("Store with 5 records and k=3 returns 3 ranked results with non-increasing scores")
    void topThree() {
        FakeEmbedder embedder = TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 0f));

        List<RetrievalResult> results = results(orchestrator.retrieve("cooling plate", new RetrievalContext(fiveRecords(), embedder), 3));

        assertEquals(3, results.size());
        assertEquals(List.of("A_00000000", "A_00000300", "B_00000000"), results.stream().map(RetrievalResult::chunkId).toList());
        assertEquals(List.of(1, 2, 3), results.stream().map(RetrievalResult::rank).toList());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
        RetrievalResult second = results.get(1);
        assertEquals("A", second.sourceId());
        assertEquals("Title A", second.metadata().get("title"));
        assertEquals(300, second.startOffset().getAsInt());
        assertEquals(1, embedder.calls());
    }

    @Test
    @DisplayName("Empty store and k=3 gives an empty success")
    void emptyStore() {
        FakeEmbedder embedder = TestEmbedders.fixed("fake:v1", Map.of(), vec(1f));

        RetrievalOutcome outcome = orchestrator.retrieve("anything", new RetrievalContext(IndexStore.empty(FP), embedder), 3);

        assertTrue(results(outcome).isEmpty());
    }

    @Test
    @DisplayName("Structured query embeds title and first claim")
    void structuredQuery() {
        StructuredQueryDocument doc = new StructuredQueryDocument("JP1", "Sensor", "abstract", List.of("A sensor.", "Claim 2."));
        FakeEmbedder embedder = TestEmbedders.fixed("fake:v1", Map.of("Sensor\nA sensor.", vec(0f, 1f)), vec(1f, 0f));

        List<RetrievalResult> results = results(orchestrator.retrieve(doc, new RetrievalContext(fiveRecords(), embedder), 1));

        assertEquals("C_00000000", results.get(0).chunkId());
    }

    @Test
    @DisplayName("Invalid queries fail before any embedding call")
    void invalidQuery() {
        FakeEmbedder embedder = TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 0f));
        RetrievalContext context = new RetrievalContext(fiveRecords(), embedder);

        assertEquals(FailureReason.INVALID_QUERY, reason(orchestrator.retrieve("  ", context, 3)));
        assertEquals(FailureReason.INVALID_QUERY, reason(orchestrator.retrieve((Object) null, context, 3)));
        assertEquals(FailureReason.INVALID_QUERY, reason(orchestrator.retrieve(42, context, 3)));
        assertEquals(FailureReason.INVALID_QUERY, reason(orchestrator.retrieve(
                new StructuredQueryDocument("JP1", "Title", "abstract", List.of()), context, 3)));
        assertEquals(0, embedder.calls());
    }

    @Test
    @DisplayName("Provider failure gives a provider error and no partial results")
    void providerError() {
        FakeEmbedder embedder = TestEmbedders.failingOn("fake:v1", Set.of("boom"), vec(1f, 0f));

        RetrievalOutcome outcome = orchestrator.retrieve("boom", new RetrievalContext(fiveRecords(), embedder), 3);

        assertEquals(FailureReason.PROVIDER_ERROR, reason(outcome));
        assertEquals(1, embedder.calls());
    }

    @Test
    @DisplayName("Provider timeout gives a provider error")
    void providerTimeout() {
        FakeEmbedder slow = new FakeEmbedder("fake:v1", text -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return vec(1f, 0f);
        });

        assertEquals(FailureReason.PROVIDER_ERROR, reason(orchestrator.retrieve("q", new RetrievalContext(fiveRecords(), slow), 3)));
    }

    @Test
    @DisplayName("Embedder of another provider or dimension is an inconsistent index")
    void inconsistentIndex() {
        FakeEmbedder otherProvider = TestEmbedders.fixed("fake:v2", Map.of(), vec(1f, 0f));
        assertEquals(FailureReason.INCONSISTENT_INDEX,
                reason(orchestrator.retrieve("q", new RetrievalContext(fiveRecords(), otherProvider), 3)));
        assertEquals(0, otherProvider.calls());

        FakeEmbedder wrongDimension = TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 0f, 0f));
        assertEquals(FailureReason.INCONSISTENT_INDEX,
                reason(orchestrator.retrieve("q", new RetrievalContext(fiveRecords(), wrongDimension), 3)));
    }

    @Test
    @DisplayName("Non-positive k is a configuration error")
    void invalidK() {
        RetrievalContext context = new RetrievalContext(fiveRecords(), TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 0f)));
        assertThrows(ConfigurationException.class, () -> orchestrator.retrieve("q", context, 0));
    }

    @Test
    @DisplayName("Repeated queries on an unchanged store return equal results, ties ordered by chunk id")
    void deterministicWithTies() {
        IndexStore tied = new IndexStore(FP, List.of(
                record("C", 0, 1f, 1f),
                record("A", 300, 2f, 2f),
                record("B", 0, 3f, 3f),
                record("A", 0, 0.5f, 0.5f),
                record("D", 0, 0f, 1f)));
        RetrievalContext context = new RetrievalContext(tied, TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 1f)));

        RetrievalOutcome first = orchestrator.retrieve("same query", context, 3);
        RetrievalOutcome second = orchestrator.retrieve("same query", context, 3);

        assertTrue(first.isSuccess());
        assertEquals(first, second);
        assertEquals(List.of("A_00000000", "A_00000300", "B_00000000"),
                results(first).stream().map(RetrievalResult::chunkId).toList());
    }

    @Test
    @DisplayName("Only successful outcomes report success")
    void successFlag() {
        RetrievalContext context = new RetrievalContext(fiveRecords(), TestEmbedders.fixed("fake:v1", Map.of(), vec(1f, 0f)));

        assertTrue(orchestrator.retrieve("q", context, 1).isSuccess());
        assertFalse(orchestrator.retrieve(" ", context, 1).isSuccess());
    }
}
