package eu.virtualparadox.priorart.exception;

import java.util.Set;

/**
 * Two or more source documents handed to a single build share the same id.
 * Chunk ids are derived from the source id, so the corpus is rejected before embedding.
 */
public class DuplicateSourceException extends IllegalArgumentException {

    private final Set<String> duplicateIds;

    public DuplicateSourceException(final Set<String> duplicateIds) {
        super("Duplicate source document ids: " + duplicateIds);
        this.duplicateIds = Set.copyOf(duplicateIds);
    }

    public Set<String> getDuplicateIds() {
        return duplicateIds;
    }
}
