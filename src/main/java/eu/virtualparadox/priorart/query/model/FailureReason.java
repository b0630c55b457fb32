package eu.virtualparadox.priorart.query.model;

public enum FailureReason {
    INVALID_QUERY,
    PROVIDER_ERROR,
    NOT_INDEXED,
    INCONSISTENT_INDEX
}
