package eu.virtualparadox.priorart.application.config;

import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j policies around embedding calls.
 * <p>The retry is used per chunk during builds only; query-time embedding is never retried.</p>
 */
@Configuration
public class ResilienceConfig {

    public static final String EMBEDDING = "embedding";

    @Bean
    public Retry embeddingRetry(final ApplicationConfig config) {
        final ApplicationConfig.Embedding props = config.getEmbedding();
        final RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(props.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        props.getInitialBackoff(), props.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof EmbeddingProviderException
                        && !Thread.currentThread().isInterrupted())
                .build();
        return Retry.of(EMBEDDING, retryConfig);
    }

    @Bean
    public TimeLimiter embeddingTimeLimiter(final ApplicationConfig config) {
        final TimeLimiterConfig timeLimiterConfig = TimeLimiterConfig.custom()
                .timeoutDuration(config.getEmbedding().getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of(EMBEDDING, timeLimiterConfig);
    }
}
