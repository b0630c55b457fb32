package eu.virtualparadox.priorart.ingest.lifecycle;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.BiConsumer;

/**
 * Tracks the embedding progress of the most recently started index build.
 * <p>Steps arrive from several embedding workers at once, hence the synchronization.</p>
 */
@Service
@Slf4j
public final class IndexBuildTracker {

    private int totalChunks = 0;
    private int processedChunks = 0;

    /**
     * Optional callback: gets invoked after each step with (processedChunks, totalChunks).
     */
    @Setter
    private volatile BiConsumer<Integer, Integer> progressCallback;

    /**
     * Resets the counters for a new build.
     *
     * @param chunkCount the number of chunks to embed
     */
    public synchronized void start(final int chunkCount) {
        totalChunks = chunkCount;
        processedChunks = 0;
        log.info("Index build started with {} chunks to embed", chunkCount);
    }

    /**
     * Called when the embedding of one chunk finished, successfully or not.
     */
    public void step() {
        final int processed;
        final int total;
        synchronized (this) {
            if (processedChunks >= totalChunks) {
                return;
            }
            processed = ++processedChunks;
            total = totalChunks;
        }

        final BiConsumer<Integer, Integer> callback = progressCallback;
        if (callback != null) {
            callback.accept(processed, total);
        }
    }

    public synchronized ProgressStatus getProgressStatus() {
        final int percent = totalChunks == 0 ? 100 : (int) ((processedChunks * 100L) / totalChunks);
        return new ProgressStatus(processedChunks, totalChunks, percent);
    }
}
