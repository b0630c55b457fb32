package eu.virtualparadox.priorart.rag.embed;

/**
 * Closed set of embedding providers, selected once through {@code priorart.embedding.provider}.
 */
public enum EmbeddingProvider {

    /** Deterministic character n-gram hashing, no model files. */
    HASHING("hashing"),

    /** Local ONNX sentence-embedding model with a HuggingFace tokenizer. */
    ONNX("onnx"),

    /** Any Spring AI {@code EmbeddingModel} bean in the context. */
    SPRING_AI("spring-ai");

    private final String key;

    EmbeddingProvider(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String providerId(final String modelId) {
        return key + ":" + modelId;
    }
}
