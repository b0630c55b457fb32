package eu.virtualparadox.priorart.exception;

/**
 * The building thread was interrupted. Nothing from the cancelled build is persisted or published.
 */
public class IndexBuildCancelledException extends RuntimeException {

    public IndexBuildCancelledException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
