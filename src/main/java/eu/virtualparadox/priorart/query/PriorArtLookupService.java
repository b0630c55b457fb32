package eu.virtualparadox.priorart.query;

import eu.virtualparadox.priorart.application.config.ApplicationConfig;
import eu.virtualparadox.priorart.ingest.lifecycle.IndexManager;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import eu.virtualparadox.priorart.query.excerpt.MatchExcerpt;
import eu.virtualparadox.priorart.query.excerpt.MatchExcerptBuilder;
import eu.virtualparadox.priorart.query.model.FailureReason;
import eu.virtualparadox.priorart.query.model.RetrievalContext;
import eu.virtualparadox.priorart.query.model.RetrievalOutcome;
import eu.virtualparadox.priorart.query.model.RetrievalResult;
import eu.virtualparadox.priorart.rag.embed.Embedder;
import eu.virtualparadox.priorart.rag.index.IndexStats;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for lookups against the currently published index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PriorArtLookupService {

    private final IndexManager indexManager;
    private final RetrievalOrchestrator retrievalOrchestrator;
    private final MatchExcerptBuilder matchExcerptBuilder;
    private final Embedder embedder;
    private final ApplicationConfig config;

    /**
     * Retrieves the configured default number of results.
     */
    public RetrievalOutcome retrieve(final Object query) {
        return retrieve(query, config.getRetrieval().getK());
    }

    /**
     * @param query a query text, a {@code StructuredQueryDocument} or a {@code RetrievalQuery}
     * @param k     maximum number of results
     * @return ranked results, or the reason why there are none
     */
    public RetrievalOutcome retrieve(final Object query, final int k) {
        // one snapshot per query; a concurrent rebuild does not affect it
        final Optional<IndexStore> store = indexManager.current();
        if (store.isEmpty()) {
            return RetrievalOutcome.failure(FailureReason.NOT_INDEXED, "No index has been opened or built");
        }
        return retrievalOrchestrator.retrieve(query, new RetrievalContext(store.get(), embedder), k);
    }

    public Optional<IndexStats> stats() {
        return indexManager.current().map(IndexStore::stats);
    }

    /**
     * Matched fragment of {@code document} with the configured amount of context.
     */
    public MatchExcerpt excerpt(final SourceDocument document, final RetrievalResult result) {
        return matchExcerptBuilder.excerpt(document, result, config.getRetrieval().getExcerptContextChars());
    }
}
