package eu.virtualparadox.priorart.rag.embed;

/**
 * Maps text to a dense, fixed-dimension vector.
 * <p>
 * The same embedder must be used to build an index and to query it; {@link #providerId()}
 * is recorded in the index fingerprint to enforce that.
 */
public interface Embedder {

    /**
     * Embeds a single text.
     *
     * @param text non-null text (chunk or composed query)
     * @return dense vector, always of the same length for one provider
     * @throws eu.virtualparadox.priorart.exception.EmbeddingProviderException if the provider fails
     */
    float[] embed(String text);

    /**
     * Stable identity of the provider and model, e.g. {@code onnx:bge-small}.
     */
    String providerId();
}
