package eu.virtualparadox.priorart.application.config;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.rag.embed.Embedder;
import eu.virtualparadox.priorart.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.priorart.rag.embed.OnnxEmbeddingService;
import eu.virtualparadox.priorart.rag.embed.SpringAiEmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the one {@link Embedder} used for both index builds and queries.
 * The choice is made here, once, and injected everywhere else.
 */
@Configuration
@Slf4j
public class EmbeddingConfig {

    @Bean
    public Embedder embedder(final ApplicationConfig config,
                             final ObjectProvider<EmbeddingModel> embeddingModels) {
        final ApplicationConfig.Embedding props = config.getEmbedding();
        final Embedder embedder = switch (props.getProvider()) {
            case HASHING -> new HashingEmbeddingService(props.getDimension());
            case ONNX -> {
                if (config.getModels() == null) {
                    throw new ConfigurationException("priorart.models must be set for the onnx provider");
                }
                yield new OnnxEmbeddingService(config.getModels().resolve("retriever"),
                        props.getModelId(), props.getConcurrency());
            }
            case SPRING_AI -> {
                final EmbeddingModel model = embeddingModels.getIfAvailable();
                if (model == null) {
                    throw new ConfigurationException(
                            "priorart.embedding.provider=spring-ai requires an EmbeddingModel bean");
                }
                yield new SpringAiEmbeddingService(model, props.getModelId());
            }
        };
        log.info("Embedding provider: {}", embedder.providerId());
        return embedder;
    }
}
