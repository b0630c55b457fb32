package eu.virtualparadox.priorart.ingest.chunker;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.ingest.model.Chunk;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-window text {@code Chunker} producing overlapping chunks with provenance.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Windowing:</strong> a window of {@code chunkSize} characters walks the text,
 *       advancing by {@code step = chunkSize - chunkOverlap}. One chunk is emitted per window
 *       start while {@code start < text.length()}; the last window is truncated to the
 *       remaining text and is never empty.</li>
 *   <li><strong>Short text:</strong> a text no longer than {@code chunkSize} yields exactly
 *       one chunk at offset 0.</li>
 *   <li><strong>Provenance:</strong> every chunk copies the source metadata and adds
 *       {@value #START_OFFSET_KEY}, so a hit can be traced back to its source segment.</li>
 * </ul>
 *
 * <h2>Reconstruction</h2>
 * Concatenating the chunks in offset order, dropping from each chunk the characters that the
 * previous chunk already covered, gives back the original text exactly.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. For a given document and parameters the output, including
 * chunk ids, is always the same.
 */
@Slf4j
@Component
public class Chunker {

    /**
     * Metadata key added to every chunk. Reserved: source metadata must not contain it.
     */
    public static final String START_OFFSET_KEY = "startOffset";

    /**
     * Maximum number of characters per chunk.
     */
    private final int chunkSize;

    /**
     * Number of characters shared by two consecutive windows.
     */
    private final int chunkOverlap;

    /**
     * Constructs a {@code Chunker} with the configured defaults.
     *
     * @param chunkSize    window length (must be {@code > 0})
     * @param chunkOverlap characters shared by neighbouring windows ({@code 0 <= overlap < size})
     * @throws ConfigurationException if constraints are violated
     */
    public Chunker(@Value("${priorart.chunking.size:400}") final int chunkSize,
                   @Value("${priorart.chunking.overlap:100}") final int chunkOverlap) {
        validateParameters(chunkSize, chunkOverlap);
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    /**
     * Chunks a document with the configured size and overlap.
     *
     * @param document source document
     * @return ordered chunks, empty for an empty text
     */
    public List<Chunk> chunk(final SourceDocument document) {
        return chunk(document, chunkSize, chunkOverlap);
    }

    /**
     * Chunks a document with explicit parameters.
     *
     * @param document source document (non-null)
     * @param size     window length
     * @param overlap  characters shared by neighbouring windows
     * @return chunks ordered by start offset; empty (with a warning) when the text is empty
     * @throws ConfigurationException if the parameters are invalid or the source metadata
     *                                already contains {@value #START_OFFSET_KEY}
     */
    public List<Chunk> chunk(final SourceDocument document, final int size, final int overlap) {
        validateParameters(size, overlap);
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (document.metadata().containsKey(START_OFFSET_KEY)) {
            throw new ConfigurationException("Source metadata of '" + document.id()
                    + "' uses the reserved key '" + START_OFFSET_KEY + "'");
        }

        final String text = document.text();
        if (text.isEmpty()) {
            log.warn("Source document {} has empty text, no chunks produced", document.id());
            return List.of();
        }

        final int length = text.length();
        if (length <= size) {
            return List.of(createChunk(document, 0, text));
        }

        final int step = size - overlap;
        final List<Chunk> result = new ArrayList<>((length + step - 1) / step);
        for (int start = 0; start < length; start += step) {
            final int end = Math.min(start + size, length);
            result.add(createChunk(document, start, text.substring(start, end)));
        }
        return result;
    }

    private static Chunk createChunk(final SourceDocument document, final int startOffset, final String text) {
        final Map<String, String> metadata = new LinkedHashMap<>(document.metadata());
        metadata.put(START_OFFSET_KEY, Integer.toString(startOffset));
        return new Chunk(document.id(), startOffset, text, metadata);
    }

    private static void validateParameters(final int size, final int overlap) {
        if (size <= 0) {
            throw new ConfigurationException("chunk size must be positive, got " + size);
        }
        if (overlap < 0 || overlap >= size) {
            throw new ConfigurationException("chunk overlap must be non-negative and less than chunk size ("
                    + size + "), got " + overlap);
        }
    }
}
