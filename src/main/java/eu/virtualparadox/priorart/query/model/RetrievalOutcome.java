package eu.virtualparadox.priorart.query.model;

import java.util.List;

/**
 * Result of a retrieval: either ranked results or an explicit failure reason.
 * Query-time failures are reported here instead of being thrown.
 */
public sealed interface RetrievalOutcome permits RetrievalOutcome.Success, RetrievalOutcome.Failure {

    record Success(List<RetrievalResult> results) implements RetrievalOutcome {
        public Success {
            results = List.copyOf(results);
        }
    }

    record Failure(FailureReason reason, String message) implements RetrievalOutcome {
    }

    static RetrievalOutcome success(final List<RetrievalResult> results) {
        return new Success(results);
    }

    static RetrievalOutcome failure(final FailureReason reason, final String message) {
        return new Failure(reason, message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
