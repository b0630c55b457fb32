package eu.virtualparadox.priorart.util;

public class LuceneConstants {
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_SOURCE_ID = "sourceId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_META_KEY = "metaKey";
    public static final String FIELD_META_VALUE = "metaValue";

    public static final String COMMIT_FORMAT_VERSION = "format.version";
    public static final String COMMIT_PROVIDER = "fingerprint.provider";
    public static final String COMMIT_CHUNK_SIZE = "fingerprint.chunkSize";
    public static final String COMMIT_CHUNK_OVERLAP = "fingerprint.chunkOverlap";
    public static final String COMMIT_DIMENSION = "store.dimension";
    public static final String COMMIT_RECORD_COUNT = "store.records";

    public static final String FORMAT_VERSION = "1";

    private LuceneConstants() {
        // prevent instantiation
    }
}
