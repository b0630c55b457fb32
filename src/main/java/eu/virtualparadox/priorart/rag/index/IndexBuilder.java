package eu.virtualparadox.priorart.rag.index;

import eu.virtualparadox.priorart.application.executor.EmbeddingWorkerExecutor;
import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.exception.DuplicateSourceException;
import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import eu.virtualparadox.priorart.exception.IndexBuildCancelledException;
import eu.virtualparadox.priorart.ingest.chunker.Chunker;
import eu.virtualparadox.priorart.ingest.lifecycle.IndexBuildTracker;
import eu.virtualparadox.priorart.ingest.model.Chunk;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import eu.virtualparadox.priorart.rag.embed.Embedder;
import eu.virtualparadox.priorart.rag.embed.EmbeddingCallGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Builds an {@link IndexStore} from a corpus of source documents:
 * <ol>
 *     <li>Reject duplicate source ids (chunk ids derive from them)</li>
 *     <li>Chunk every document with the fingerprint's size and overlap</li>
 *     <li>Embed the chunks on the bounded worker pool, each call time-limited and retried</li>
 *     <li>Assemble the immutable store</li>
 * </ol>
 * <p>
 * A chunk whose embedding keeps failing, or whose vector does not match the dimension of the
 * first accepted one, is dropped with a warning instead of failing the build. The result is
 * not persisted nor published here; see {@code IndexManager}.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexBuilder {

    private final Chunker chunker;
    private final EmbeddingCallGuard embeddingCallGuard;
    private final EmbeddingWorkerExecutor embeddingWorkerExecutor;
    private final IndexBuildTracker indexBuildTracker;

    /**
     * Builds a store for {@code documents}.
     *
     * @param documents   corpus to index
     * @param embedder    provider used for every chunk; must match {@code fingerprint}
     * @param fingerprint configuration the store is built for
     * @return the store plus what was dropped or worth a warning
     * @throws DuplicateSourceException      if two documents share an id
     * @throws ConfigurationException        if the embedder does not match the fingerprint
     * @throws IndexBuildCancelledException  if the calling thread is interrupted
     */
    public IndexBuildReport build(final List<SourceDocument> documents,
                                  final Embedder embedder,
                                  final Fingerprint fingerprint) {
        if (!fingerprint.embeddingProviderId().equals(embedder.providerId())) {
            throw new ConfigurationException("Embedder " + embedder.providerId()
                    + " does not match fingerprint provider " + fingerprint.embeddingProviderId());
        }
        requireUniqueIds(documents);

        // chunk
        final List<String> warnings = new ArrayList<>();
        final List<Chunk> chunks = new ArrayList<>();
        for (final SourceDocument document : documents) {
            final List<Chunk> documentChunks = chunker.chunk(document, fingerprint.chunkSize(), fingerprint.chunkOverlap());
            if (documentChunks.isEmpty()) {
                warnings.add("Source document '" + document.id() + "' has empty text and was not indexed");
            }
            chunks.addAll(documentChunks);
        }
        log.info("Building index {} from {} documents, {} chunks", fingerprint, documents.size(), chunks.size());

        // embed
        indexBuildTracker.start(chunks.size());
        final List<Future<IndexRecord>> futures = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            futures.add(embeddingWorkerExecutor.submit(() -> embedChunk(chunk, embedder)));
        }

        // collected in chunk order, so the first accepted vector fixes the dimension deterministically
        final List<IndexRecord> records = new ArrayList<>(chunks.size());
        final List<String> dropped = new ArrayList<>();
        int dimension = 0;
        for (int i = 0; i < futures.size(); i++) {
            final IndexRecord record = await(futures, i);
            if (record == null) {
                dropped.add(chunks.get(i).chunkId());
            } else if (dimension != 0 && record.dimension() != dimension) {
                log.warn("Dropping chunk {}: provider returned dimension {}, expected {}",
                        record.chunkId(), record.dimension(), dimension);
                dropped.add(record.chunkId());
            } else {
                dimension = record.dimension();
                records.add(record);
            }
        }

        if (!dropped.isEmpty()) {
            warnings.add(dropped.size() + " chunk(s) dropped after failed or inconsistent embeddings");
        }

        final IndexStore store = new IndexStore(fingerprint, records);
        log.info("Index {} built: {} records, {} dropped, {} warnings",
                fingerprint, store.size(), dropped.size(), warnings.size());
        return new IndexBuildReport(store, documents.size(), chunks.size(), dropped, warnings);
    }

    /**
     * Embeds one chunk. Returns {@code null} when the chunk has to be dropped.
     */
    private IndexRecord embedChunk(final Chunk chunk, final Embedder embedder) {
        try {
            final float[] vector = embeddingCallGuard.embedWithRetry(embedder, chunk.text());
            return new IndexRecord(chunk.chunkId(), chunk.sourceId(), vector, chunk.text(), chunk.metadata());
        } catch (final EmbeddingProviderException e) {
            log.warn("Dropping chunk {} after failed embedding attempts: {}", chunk.chunkId(), e.getMessage());
            return null;
        } finally {
            indexBuildTracker.step();
        }
    }

    private IndexRecord await(final List<Future<IndexRecord>> futures, final int index) {
        try {
            return futures.get(index).get();
        } catch (final InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IndexBuildCancelledException("Index build cancelled", e);
        } catch (final ExecutionException e) {
            cancelAll(futures);
            throw new IllegalStateException("Index build failed", e.getCause());
        }
    }

    private static void cancelAll(final List<Future<IndexRecord>> futures) {
        for (final Future<IndexRecord> future : futures) {
            future.cancel(true);
        }
    }

    private static void requireUniqueIds(final List<SourceDocument> documents) {
        final Set<String> seen = new HashSet<>();
        final Set<String> duplicates = new TreeSet<>();
        for (final SourceDocument document : documents) {
            if (!seen.add(document.id())) {
                duplicates.add(document.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateSourceException(duplicates);
        }
    }
}
