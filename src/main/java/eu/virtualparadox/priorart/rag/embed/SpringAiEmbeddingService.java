package eu.virtualparadox.priorart.rag.embed;

import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Adapts a Spring AI {@link EmbeddingModel} (OpenAI, Ollama, ...) to {@link Embedder}.
 */
@Slf4j
public final class SpringAiEmbeddingService implements Embedder {

    private final EmbeddingModel embeddingModel;
    private final String providerId;

    public SpringAiEmbeddingService(final EmbeddingModel embeddingModel, final String modelId) {
        this.embeddingModel = embeddingModel;
        this.providerId = EmbeddingProvider.SPRING_AI.providerId(modelId);
        log.info("Using Spring AI embedding model {} as {}", embeddingModel.getClass().getSimpleName(), providerId);
    }

    @Override
    public float[] embed(final String text) {
        try {
            return embeddingModel.embed(text);
        } catch (final RuntimeException e) {
            throw new EmbeddingProviderException("Spring AI embedding call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String providerId() {
        return providerId;
    }
}
