package eu.virtualparadox.priorart.rag.index;

import eu.virtualparadox.priorart.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import static eu.virtualparadox.priorart.util.LuceneConstants.*;

/**
 * Lucene-backed {@link IndexStoreRepository}: one on-disk Lucene index per fingerprint.
 *
 * <h3>Layout</h3>
 * <pre>
 *   {index-root}/{fingerprint.storageKey()}/   committed Lucene index
 * </pre>
 * Deleting a fingerprint directory and rebuilding is always safe.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunkId}, {@code sourceId} – {@link StringField}, stored</li>
 *   <li>{@code text} – {@link StoredField}</li>
 *   <li>{@code vector} – {@link StoredField} with the raw little-endian IEEE-754 floats,
 *       so vectors round-trip bit for bit</li>
 *   <li>{@code metaKey}/{@code metaValue} – repeated {@link StoredField}s; Lucene keeps the
 *       order of stored values, which preserves the metadata order</li>
 * </ul>
 * The fingerprint, dimension and record count live in the commit user data.
 *
 * <h3>Atomic replacement</h3>
 * A snapshot is written to a staging directory and committed there first. The old directory
 * is then moved aside, the staging directory moved into place and the old one deleted.
 */
@Service
@Slf4j
public final class LuceneIndexStoreRepository implements IndexStoreRepository {

    private static final String STAGING_SUFFIX = ".staging-";
    private static final String RETIRED_SUFFIX = ".retired-";

    private final Path indexRoot;

    @Autowired
    public LuceneIndexStoreRepository(final ApplicationConfig config) {
        this(config.getIndex());
    }

    public LuceneIndexStoreRepository(final Path indexRoot) {
        if (indexRoot == null) {
            throw new IllegalArgumentException("indexRoot cannot be null");
        }
        this.indexRoot = indexRoot;
    }

    @Override
    public void save(final IndexStore store) throws IOException {
        final Fingerprint fingerprint = store.fingerprint();
        final String key = fingerprint.storageKey();
        Files.createDirectories(indexRoot);

        final Path staging = indexRoot.resolve(key + STAGING_SUFFIX + UUID.randomUUID());
        try (final Directory directory = FSDirectory.open(staging);
             final IndexWriter writer = new IndexWriter(directory,
                     new IndexWriterConfig().setOpenMode(IndexWriterConfig.OpenMode.CREATE))) {

            for (final IndexRecord record : store.records()) {
                writer.addDocument(buildLuceneDocument(record));
            }
            writer.setLiveCommitData(commitData(store).entrySet());
            writer.commit();
        } catch (final IOException | RuntimeException e) {
            deleteRecursively(staging);
            throw e;
        }

        swapIntoPlace(staging, indexRoot.resolve(key));
        log.info("Persisted index {} with {} records under {}", fingerprint, store.size(), key);
    }

    @Override
    public Optional<IndexStore> load(final Fingerprint fingerprint) throws IOException {
        final Path target = indexRoot.resolve(fingerprint.storageKey());
        if (!Files.isDirectory(target)) {
            log.info("No persisted index for {}", fingerprint);
            return Optional.empty();
        }

        try (final Directory directory = FSDirectory.open(target)) {
            if (!DirectoryReader.indexExists(directory)) {
                log.warn("Index directory {} holds no committed index", target);
                return Optional.empty();
            }

            try (final DirectoryReader reader = DirectoryReader.open(directory)) {
                final Map<String, String> userData = reader.getIndexCommit().getUserData();
                final Fingerprint stored = fingerprintOf(userData);
                if (!fingerprint.equals(stored)) {
                    log.info("Persisted index under {} was built with {}, requested {}", target, stored, fingerprint);
                    return Optional.empty();
                }

                final List<IndexRecord> records = new ArrayList<>(reader.maxDoc());
                final StoredFields storedFields = reader.storedFields();
                for (int i = 0; i < reader.maxDoc(); i++) {
                    records.add(toIndexRecord(storedFields.document(i)));
                }

                final String expectedCount = userData.get(COMMIT_RECORD_COUNT);
                if (!String.valueOf(records.size()).equals(expectedCount)) {
                    log.warn("Index under {} holds {} records but its commit declares {}", target, records.size(), expectedCount);
                    return Optional.empty();
                }

                log.info("Loaded persisted index {} with {} records", fingerprint, records.size());
                return Optional.of(new IndexStore(fingerprint, records));
            }
        }
    }

    @Override
    public boolean delete(final Fingerprint fingerprint) throws IOException {
        final Path target = indexRoot.resolve(fingerprint.storageKey());
        if (!Files.exists(target)) {
            return false;
        }
        final Path retired = indexRoot.resolve(fingerprint.storageKey() + RETIRED_SUFFIX + UUID.randomUUID());
        Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
        deleteRecursively(retired);
        log.info("Deleted persisted index {}", fingerprint);
        return true;
    }

    /**
     * Builds a Lucene {@link Document} for a single record.
     */
    private Document buildLuceneDocument(final IndexRecord record) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_CHUNK_ID, record.chunkId(), Field.Store.YES));
        d.add(new StringField(FIELD_SOURCE_ID, record.sourceId(), Field.Store.YES));

        // Payload
        d.add(new StoredField(FIELD_TEXT, record.text()));
        d.add(new StoredField(FIELD_VECTOR, encodeVector(record.vector())));

        // Metadata, pairwise and in order
        for (final Map.Entry<String, String> entry : record.metadata().entrySet()) {
            d.add(new StoredField(FIELD_META_KEY, entry.getKey()));
            d.add(new StoredField(FIELD_META_VALUE, entry.getValue()));
        }
        return d;
    }

    private IndexRecord toIndexRecord(final Document d) {
        final String[] keys = d.getValues(FIELD_META_KEY);
        final String[] values = d.getValues(FIELD_META_VALUE);
        if (keys.length != values.length) {
            throw new IllegalStateException("Corrupt metadata for chunk " + d.get(FIELD_CHUNK_ID));
        }
        final Map<String, String> metadata = new LinkedHashMap<>();
        for (int i = 0; i < keys.length; i++) {
            metadata.put(keys[i], values[i]);
        }

        return new IndexRecord(
                d.get(FIELD_CHUNK_ID),
                d.get(FIELD_SOURCE_ID),
                decodeVector(d.getBinaryValue(FIELD_VECTOR)),
                d.get(FIELD_TEXT),
                metadata);
    }

    private static Map<String, String> commitData(final IndexStore store) {
        final Fingerprint fingerprint = store.fingerprint();
        final Map<String, String> data = new HashMap<>();
        data.put(COMMIT_FORMAT_VERSION, FORMAT_VERSION);
        data.put(COMMIT_PROVIDER, fingerprint.embeddingProviderId());
        data.put(COMMIT_CHUNK_SIZE, Integer.toString(fingerprint.chunkSize()));
        data.put(COMMIT_CHUNK_OVERLAP, Integer.toString(fingerprint.chunkOverlap()));
        data.put(COMMIT_DIMENSION, Integer.toString(store.dimension()));
        data.put(COMMIT_RECORD_COUNT, Integer.toString(store.size()));
        return data;
    }

    /**
     * Reads the fingerprint back from commit user data.
     *
     * @return stored fingerprint, or {@code null} if it is missing, unreadable or of another format
     */
    private static Fingerprint fingerprintOf(final Map<String, String> userData) {
        if (!FORMAT_VERSION.equals(userData.get(COMMIT_FORMAT_VERSION))) {
            return null;
        }
        try {
            return new Fingerprint(
                    userData.get(COMMIT_PROVIDER),
                    Integer.parseInt(userData.get(COMMIT_CHUNK_SIZE)),
                    Integer.parseInt(userData.get(COMMIT_CHUNK_OVERLAP)));
        } catch (final IllegalArgumentException e) {
            // NumberFormatException included
            log.warn("Unreadable fingerprint in commit data {}: {}", userData, e.getMessage());
            return null;
        }
    }

    static byte[] encodeVector(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }

    static float[] decodeVector(final BytesRef bytes) {
        if (bytes == null || bytes.length % Float.BYTES != 0) {
            throw new IllegalStateException("Corrupt vector field");
        }
        final float[] vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asFloatBuffer()
                .get(vector);
        return vector;
    }

    private void swapIntoPlace(final Path staging, final Path target) throws IOException {
        Path retired = null;
        if (Files.exists(target)) {
            retired = target.resolveSibling(target.getFileName() + RETIRED_SUFFIX + UUID.randomUUID());
            Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
        }
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            if (retired != null) {
                Files.move(retired, target, StandardCopyOption.ATOMIC_MOVE);
            }
            deleteRecursively(staging);
            throw e;
        }
        if (retired != null) {
            deleteRecursively(retired);
        }
    }

    private static void deleteRecursively(final Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (final Stream<Path> walk = Files.walk(path)) {
            final List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (final Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }
}
