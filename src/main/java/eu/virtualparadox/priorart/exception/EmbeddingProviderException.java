package eu.virtualparadox.priorart.exception;

/**
 * An embedding call failed, returned an unusable vector or exceeded its time budget.
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(final String message) {
        super(message);
    }

    public EmbeddingProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
