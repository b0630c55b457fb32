package eu.virtualparadox.priorart.ingest.lifecycle;

import eu.virtualparadox.priorart.ingest.chunker.Chunker;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import eu.virtualparadox.priorart.rag.embed.Embedder;
import eu.virtualparadox.priorart.rag.index.Fingerprint;
import eu.virtualparadox.priorart.rag.index.IndexBuildReport;
import eu.virtualparadox.priorart.rag.index.IndexBuilder;
import eu.virtualparadox.priorart.rag.index.IndexStore;
import eu.virtualparadox.priorart.rag.index.IndexStoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages the lifecycle of the index store the application queries:
 * <ul>
 *   <li>Reuse of a persisted store whose fingerprint matches the configuration</li>
 *   <li>Build, persist and publish otherwise</li>
 *   <li>Deletion of the persisted store</li>
 * </ul>
 * <p>
 * The published store is swapped atomically and only after it has been saved, so a query
 * sees the old or the new store, never a partial one. A failed or cancelled build leaves the
 * previous store published. Builds for the same fingerprint run one at a time.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexManager {

    private final IndexBuilder indexBuilder;
    private final IndexStoreRepository indexStoreRepository;
    private final Chunker chunker;
    private final Embedder embedder;

    private final AtomicReference<IndexStore> published = new AtomicReference<>();
    private final Map<Fingerprint, ReentrantLock> buildLocks = new ConcurrentHashMap<>();

    /**
     * Fingerprint of the running configuration: embedder identity plus chunking parameters.
     */
    public Fingerprint fingerprint() {
        return new Fingerprint(embedder.providerId(), chunker.getChunkSize(), chunker.getChunkOverlap());
    }

    /**
     * Publishes the persisted store for the current fingerprint, building it from
     * {@code documents} if none is persisted.
     *
     * @return the published store
     * @throws UncheckedIOException if the store cannot be read or written
     */
    public IndexStore open(final List<SourceDocument> documents) {
        final Fingerprint fingerprint = fingerprint();
        final ReentrantLock lock = lockFor(fingerprint);
        lock.lock();
        try {
            final Optional<IndexStore> loaded = load(fingerprint);
            if (loaded.isPresent()) {
                publish(loaded.get());
                return loaded.get();
            }
            log.info("No usable index for {}, building from {} documents", fingerprint, documents.size());
            return buildSaveAndPublish(documents, fingerprint).store();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds, persists and publishes a fresh store, replacing any persisted one.
     *
     * @return the build report of the published store
     * @throws UncheckedIOException if the store cannot be written
     */
    public IndexBuildReport rebuild(final List<SourceDocument> documents) {
        final Fingerprint fingerprint = fingerprint();
        final ReentrantLock lock = lockFor(fingerprint);
        lock.lock();
        try {
            return buildSaveAndPublish(documents, fingerprint);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the store queries currently run against, if any
     */
    public Optional<IndexStore> current() {
        return Optional.ofNullable(published.get());
    }

    /**
     * Removes the persisted store of the current fingerprint and unpublishes it.
     *
     * @return {@code true} if a persisted store was removed
     */
    public boolean delete() {
        final Fingerprint fingerprint = fingerprint();
        final ReentrantLock lock = lockFor(fingerprint);
        lock.lock();
        try {
            final boolean deleted = indexStoreRepository.delete(fingerprint);
            final IndexStore current = published.get();
            if (current != null && current.fingerprint().equals(fingerprint)) {
                published.compareAndSet(current, null);
            }
            log.info("Index {} deleted (persisted copy found: {})", fingerprint, deleted);
            return deleted;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to delete index " + fingerprint, e);
        } finally {
            lock.unlock();
        }
    }

    private IndexBuildReport buildSaveAndPublish(final List<SourceDocument> documents, final Fingerprint fingerprint) {
        final IndexBuildReport report = indexBuilder.build(documents, embedder, fingerprint);
        for (final String warning : report.warnings()) {
            log.warn("Index build {}: {}", fingerprint, warning);
        }
        try {
            indexStoreRepository.save(report.store());
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to persist index " + fingerprint, e);
        }
        publish(report.store());
        return report;
    }

    private Optional<IndexStore> load(final Fingerprint fingerprint) {
        try {
            return indexStoreRepository.load(fingerprint);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load index " + fingerprint, e);
        }
    }

    private void publish(final IndexStore store) {
        published.set(store);
        log.info("Published index {} ({} records)", store.fingerprint(), store.size());
    }

    private ReentrantLock lockFor(final Fingerprint fingerprint) {
        return buildLocks.computeIfAbsent(fingerprint, f -> new ReentrantLock());
    }
}
