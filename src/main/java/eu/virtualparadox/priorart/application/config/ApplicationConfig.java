package eu.virtualparadox.priorart.application.config;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.rag.embed.EmbeddingProvider;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "priorart")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path models;

    private final Retrieval retrieval = new Retrieval();
    private final Embedding embedding = new Embedding();

    @PostConstruct
    public void ensureFolders() throws IOException {
        validate();
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
    }

    /**
     * Fails fast on settings that would only break later, in the middle of a build or query.
     */
    public void validate() {
        if (index == null) {
            throw new ConfigurationException("priorart.index must be set");
        }
        if (retrieval.k <= 0) {
            throw new ConfigurationException("priorart.retrieval.k must be positive, got " + retrieval.k);
        }
        if (retrieval.excerptContextChars < 0) {
            throw new ConfigurationException("priorart.retrieval.excerpt-context-chars must not be negative");
        }
        if (embedding.provider == null) {
            throw new ConfigurationException("priorart.embedding.provider must be set");
        }
        if (embedding.concurrency <= 0) {
            throw new ConfigurationException("priorart.embedding.concurrency must be positive, got " + embedding.concurrency);
        }
        if (embedding.maxAttempts < 1) {
            throw new ConfigurationException("priorart.embedding.max-attempts must be at least 1");
        }
        if (embedding.dimension <= 0) {
            throw new ConfigurationException("priorart.embedding.dimension must be positive");
        }
        if (isNotPositive(embedding.timeout) || isNotPositive(embedding.initialBackoff)) {
            throw new ConfigurationException("priorart.embedding timeout and initial-backoff must be positive");
        }
        if (embedding.backoffMultiplier < 1.0) {
            throw new ConfigurationException("priorart.embedding.backoff-multiplier must be >= 1.0");
        }
    }

    private static boolean isNotPositive(final Duration duration) {
        return duration == null || duration.isNegative() || duration.isZero();
    }

    @Getter @Setter
    public static class Retrieval {

        /** Number of results returned when the caller does not ask for a specific k. */
        private int k = 10;

        /** Characters of context shown on each side of a matched chunk. */
        private int excerptContextChars = 200;
    }

    @Getter @Setter
    public static class Embedding {

        private EmbeddingProvider provider = EmbeddingProvider.HASHING;

        /** Model identity recorded in the index fingerprint. */
        private String modelId = "default";

        /** Vector length of the hashing provider. */
        private int dimension = 384;

        /** Maximum number of embedding calls in flight during a build. */
        private int concurrency = 4;

        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
    }
}
