package eu.virtualparadox.priorart.query;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import eu.virtualparadox.priorart.query.model.FailureReason;
import eu.virtualparadox.priorart.query.model.RetrievalContext;
import eu.virtualparadox.priorart.query.model.RetrievalOutcome;
import eu.virtualparadox.priorart.query.model.RetrievalQuery;
import eu.virtualparadox.priorart.query.model.RetrievalResult;
import eu.virtualparadox.priorart.rag.embed.EmbeddingCallGuard;
import eu.virtualparadox.priorart.rag.index.IndexRecord;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.retriever.model.SearchHit;
import eu.virtualparadox.priorart.rag.retriever.service.SimilaritySearchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.priorart.query.model.FailureReason.*;

/**
 * Answers one query against one store snapshot.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Compose the query text (pure, fails before any provider call)</li>
 *   <li>Embed it: one time-bounded call, no retry</li>
 *   <li>Search the store for the top-k chunks</li>
 *   <li>Join hits with their records and assign ranks</li>
 * </ol>
 * Apart from an invalid {@code k}, nothing is thrown: every failure becomes a
 * {@link RetrievalOutcome.Failure} and no partial results are returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetrievalOrchestrator {

    private final QueryComposer queryComposer;
    private final EmbeddingCallGuard embeddingCallGuard;
    private final SimilaritySearchEngine similaritySearchEngine;

    /**
     * Accepts a {@link String}, a {@code StructuredQueryDocument} or a {@link RetrievalQuery}.
     * Anything else, {@code null} included, is an invalid query.
     */
    public RetrievalOutcome retrieve(final Object query, final RetrievalContext context, final int k) {
        final Optional<RetrievalQuery> resolved = RetrievalQuery.resolve(query);
        if (resolved.isEmpty()) {
            requirePositive(k);
            final String type = query == null ? "null" : query.getClass().getSimpleName();
            log.debug("Rejected query of unsupported type {}", type);
            return RetrievalOutcome.failure(INVALID_QUERY, "Unsupported query type: " + type);
        }
        return retrieve(resolved.get(), context, k);
    }

    /**
     * @param query   query to answer
     * @param context store snapshot and embedder
     * @param k       maximum number of results
     * @throws ConfigurationException if {@code k <= 0}
     */
    public RetrievalOutcome retrieve(final RetrievalQuery query, final RetrievalContext context, final int k) {
        requirePositive(k);

        // 1. compose
        final Optional<String> problem = queryComposer.validate(query);
        if (problem.isPresent()) {
            log.debug("Rejected query: {}", problem.get());
            return RetrievalOutcome.failure(INVALID_QUERY, problem.get());
        }
        final String text = queryComposer.compose(query);

        final IndexStore store = context.store();
        final String providerId = context.embedder().providerId();
        if (!store.fingerprint().embeddingProviderId().equals(providerId)) {
            return inconsistent("Store was built with " + store.fingerprint().embeddingProviderId()
                    + " but queries are embedded with " + providerId);
        }
        if (store.isEmpty()) {
            return RetrievalOutcome.success(List.of());
        }

        // 2. embed
        final float[] vector;
        try {
            vector = embeddingCallGuard.embed(context.embedder(), text);
        } catch (final EmbeddingProviderException e) {
            log.warn("Query embedding failed: {}", e.getMessage());
            return RetrievalOutcome.failure(PROVIDER_ERROR, e.getMessage());
        }

        // 3. search
        final List<SearchHit> hits;
        try {
            hits = similaritySearchEngine.search(store, vector, k);
        } catch (final IllegalArgumentException e) {
            return inconsistent(e.getMessage());
        }

        // 4. assemble
        final List<RetrievalResult> results = new ArrayList<>(hits.size());
        for (final SearchHit hit : hits) {
            final Optional<IndexRecord> record = store.get(hit.chunkId());
            if (record.isEmpty()) {
                return inconsistent("Search returned unknown chunk " + hit.chunkId());
            }
            final IndexRecord r = record.get();
            results.add(new RetrievalResult(results.size() + 1, r.chunkId(), r.sourceId(), hit.score(), r.text(), r.metadata()));
        }

        printDebugResults(results);
        return RetrievalOutcome.success(results);
    }

    private static void requirePositive(final int k) {
        if (k <= 0) {
            throw new ConfigurationException("k must be positive, got " + k);
        }
    }

    private static RetrievalOutcome inconsistent(final String message) {
        log.error("Inconsistent index: {}", message);
        return RetrievalOutcome.failure(FailureReason.INCONSISTENT_INDEX, message);
    }

    private void printDebugResults(final List<RetrievalResult> results) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final RetrievalResult r : results) {
            sb.append(" - ").append(r.rank()).append(". [").append(r.score()).append("] ").append(r.chunkId()).append("\n");
        }
        log.debug("Retrieved chunks:\n{}", sb);
    }
}
