package eu.virtualparadox.priorart;

import eu.virtualparadox.priorart.ingest.lifecycle.IndexManager;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import eu.virtualparadox.priorart.query.PriorArtLookupService;
import eu.virtualparadox.priorart.query.excerpt.MatchExcerpt;
import eu.virtualparadox.priorart.query.model.FailureReason;
import eu.virtualparadox.priorart.query.model.RetrievalOutcome;
import eu.virtualparadox.priorart.query.model.RetrievalResult;
import eu.virtualparadox.priorart.query.model.StructuredQueryDocument;
import eu.virtualparadox.priorart.rag.index.IndexStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the whole application with the hashing provider and an index in a temporary folder.
 */
@SpringBootTest
class PriorArtLookupApplicationTest {

    @TempDir
    static Path root;

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("priorart.root", () -> root.toString());
        registry.add("priorart.index", () -> root.resolve("index").toString());
        registry.add("priorart.models", () -> root.resolve("models").toString());
        registry.add("priorart.chunking.size", () -> "60");
        registry.add("priorart.chunking.overlap", () -> "10");
        registry.add("priorart.retrieval.k", () -> "2");
        registry.add("priorart.retrieval.excerpt-context-chars", () -> "5");
    }

    @Autowired
    private IndexManager indexManager;

    @Autowired
    private PriorArtLookupService lookupService;

    private static final SourceDocument BATTERY = new SourceDocument("JP2019-100001",
            "A battery module has a cooling plate arranged between adjacent battery cells. "
                    + "The cooling plate carries coolant through internal channels.",
            Map.of("title", "Battery module", "path", "/corpus/JP2019-100001.txt"));

    private static final SourceDocument TEA = new SourceDocument("JP2018-200002",
            "A method for brewing green tea, in which tea leaves are steamed and rolled before drying.",
            Map.of("title", "Tea brewing"));

    @Test
    @DisplayName("Opened corpus answers structured queries with ranked, traceable results")
    void endToEnd() {
        indexManager.delete();
        assertEquals(FailureReason.NOT_INDEXED,
                assertInstanceOf(RetrievalOutcome.Failure.class, lookupService.retrieve("cooling plate")).reason());

        indexManager.open(List.of(BATTERY, TEA));

        StructuredQueryDocument query = new StructuredQueryDocument("JP2024-000003", "Battery cooling",
                "abstract", List.of("A battery module comprising a cooling plate between battery cells."));
        RetrievalOutcome outcome = lookupService.retrieve(query);

        List<RetrievalResult> results = assertInstanceOf(RetrievalOutcome.Success.class, outcome).results();
        assertEquals(2, results.size());
        RetrievalResult best = results.get(0);
        assertEquals(BATTERY.id(), best.sourceId());
        assertEquals("Battery module", best.metadata().get("title"));

        MatchExcerpt excerpt = lookupService.excerpt(BATTERY, best);
        assertEquals(best.text(), excerpt.match());

        IndexStats stats = lookupService.stats().orElseThrow();
        assertEquals(2, stats.sourceCount());
        assertEquals(384, stats.dimension());
        assertEquals("hashing:dim384", stats.fingerprint().embeddingProviderId());
    }
}
