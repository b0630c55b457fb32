package eu.virtualparadox.priorart.rag.embed;

import eu.virtualparadox.priorart.application.executor.EmbeddingCallExecutor;
import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeoutException;

/**
 * Wraps provider calls with a time budget and, for builds, a bounded retry.
 * <p>
 * Every failure mode (provider exception, timeout, interruption, empty vector) is reported
 * as {@link EmbeddingProviderException}, so callers handle exactly one error type.
 * </p>
 * <p>
 * Calls run on the bounded {@link EmbeddingCallExecutor}. The time budget covers waiting for a
 * free slot there; a call that times out while still queued never reaches the provider.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class EmbeddingCallGuard {

    private final Retry embeddingRetry;
    private final TimeLimiter embeddingTimeLimiter;
    private final EmbeddingCallExecutor embeddingCallExecutor;

    /**
     * Single time-bounded attempt. Used at query time, where the caller is waiting.
     *
     * @param embedder provider to call
     * @param text     text to embed
     * @return non-empty vector
     * @throws EmbeddingProviderException on failure or timeout
     */
    public float[] embed(final Embedder embedder, final String text) {
        final float[] vector;
        try {
            vector = embeddingTimeLimiter.executeFutureSupplier(
                    () -> embeddingCallExecutor.submit(() -> embedder.embed(text)));
        } catch (final TimeoutException e) {
            throw new EmbeddingProviderException("Embedding call to " + embedder.providerId()
                    + " timed out after " + embeddingTimeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("Embedding call to " + embedder.providerId() + " was interrupted", e);
        } catch (final EmbeddingProviderException e) {
            throw e;
        } catch (final Exception e) {
            throw new EmbeddingProviderException("Embedding call to " + embedder.providerId()
                    + " failed: " + e.getMessage(), e);
        }

        if (vector == null || vector.length == 0) {
            throw new EmbeddingProviderException("Provider " + embedder.providerId() + " returned an empty vector");
        }
        return vector;
    }

    /**
     * Time-bounded call retried with exponential backoff. Used per chunk during builds.
     *
     * @throws EmbeddingProviderException once all attempts are used up
     */
    public float[] embedWithRetry(final Embedder embedder, final String text) {
        return Retry.decorateSupplier(embeddingRetry, () -> embed(embedder, text)).get();
    }
}
