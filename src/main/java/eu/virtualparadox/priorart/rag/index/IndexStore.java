package eu.virtualparadox.priorart.rag.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of an embedded corpus, keyed by chunk id.
 * <p>
 * A store is never modified after construction: a rebuild produces a new instance that is
 * swapped in by the {@code IndexManager}, so readers see either the old or the new store.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>chunk ids are unique; {@link #records()} iterates in ascending chunk id order</li>
 *   <li>all vectors have the same dimension</li>
 * </ul>
 */
public final class IndexStore {

    private final Fingerprint fingerprint;
    private final SortedMap<String, IndexRecord> records;
    private final int dimension;

    /**
     * @param fingerprint configuration that produced the records
     * @param records     records to hold
     * @throws IllegalArgumentException on duplicate chunk ids or mixed vector dimensions
     */
    public IndexStore(final Fingerprint fingerprint, final Collection<IndexRecord> records) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");

        final TreeMap<String, IndexRecord> byId = new TreeMap<>();
        int dim = 0;
        for (final IndexRecord record : records) {
            if (byId.put(record.chunkId(), record) != null) {
                throw new IllegalArgumentException("Duplicate chunk id: " + record.chunkId());
            }
            if (dim == 0) {
                dim = record.dimension();
            } else if (dim != record.dimension()) {
                throw new IllegalArgumentException("Vector dimension mismatch. Existing=" + dim
                        + ", chunk " + record.chunkId() + "=" + record.dimension());
            }
        }
        this.records = Collections.unmodifiableSortedMap(byId);
        this.dimension = dim;
    }

    public static IndexStore empty(final Fingerprint fingerprint) {
        return new IndexStore(fingerprint, List.of());
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    public Optional<IndexRecord> get(final String chunkId) {
        return Optional.ofNullable(records.get(chunkId));
    }

    /**
     * @return all records in ascending chunk id order
     */
    public List<IndexRecord> records() {
        return new ArrayList<>(records.values());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * @return vector length, or 0 when the store is empty
     */
    public int dimension() {
        return dimension;
    }

    public IndexStats stats() {
        final Set<String> sources = new HashSet<>();
        for (final IndexRecord record : records.values()) {
            sources.add(record.sourceId());
        }
        return new IndexStats(fingerprint, records.size(), sources.size(), dimension);
    }

    /**
     * Two stores are equal when they share the fingerprint and hold equal record sets.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexStore other)) return false;
        return fingerprint.equals(other.fingerprint) && records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, records);
    }

    @Override
    public String toString() {
        return "IndexStore[" + fingerprint + ", records=" + records.size() + ", dim=" + dimension + "]";
    }
}
