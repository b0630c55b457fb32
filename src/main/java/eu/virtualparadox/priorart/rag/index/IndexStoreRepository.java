package eu.virtualparadox.priorart.rag.index;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage of {@link IndexStore} snapshots, keyed by {@link Fingerprint}.
 * <p>
 * Notes:
 * <ul>
 *   <li>A snapshot is written and deleted as one unit; readers never observe a half-written one.</li>
 *   <li>{@link #load(Fingerprint)} never makes embedding calls: it only reads what was stored.</li>
 * </ul>
 */
public interface IndexStoreRepository {

    /**
     * Persists {@code store} under its fingerprint, replacing any previous snapshot for it.
     *
     * @param store store to persist
     * @throws IOException if writing fails; a previous snapshot stays intact in that case
     */
    void save(final IndexStore store) throws IOException;

    /**
     * Loads the snapshot stored for exactly this fingerprint.
     *
     * @param fingerprint query-time fingerprint
     * @return the stored snapshot, or empty when none exists or the stored fingerprint differs
     * @throws IOException if the stored snapshot exists but cannot be read
     */
    Optional<IndexStore> load(final Fingerprint fingerprint) throws IOException;

    /**
     * Removes the snapshot for {@code fingerprint}.
     *
     * @return {@code true} if a snapshot was removed
     * @throws IOException if deletion fails
     */
    boolean delete(final Fingerprint fingerprint) throws IOException;
}
