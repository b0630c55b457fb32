package eu.virtualparadox.priorart.exception;

/**
 * Invalid chunking, retrieval or provider configuration.
 * <p>Raised before any build or query work starts and never retried.</p>
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
