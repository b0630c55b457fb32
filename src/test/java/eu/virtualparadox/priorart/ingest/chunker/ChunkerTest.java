package eu.virtualparadox.priorart.ingest.chunker;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.ingest.model.Chunk;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ChunkerTest {

    private static final int SIZE = 400;
    private static final int OVERLAP = 100;

    private final Chunker chunker = new Chunker(SIZE, OVERLAP);

    // ---------- Helpers ----------

    private static String randomText(int length, long seed) {
        Random rnd = new Random(seed);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(rnd.nextInt(8) == 0 ? ' ' : (char) ('a' + rnd.nextInt(26)));
        }
        return sb.toString();
    }

    /**
     * Rebuilds the text by dropping from each chunk what the previous chunk already covered.
     */
    private static String reconstruct(List<Chunk> chunks) {
        StringBuilder sb = new StringBuilder();
        int covered = 0;
        for (Chunk c : chunks) {
            int end = c.startOffset() + c.text().length();
            if (end > covered) {
                sb.append(c.text().substring(covered - c.startOffset()));
                covered = end;
            }
        }
        return sb.toString();
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("1000 chars with size 400 and overlap 100 start at 0, 300, 600 and 900")
    void windowOffsets() {
        List<Chunk> chunks = chunker.chunk(SourceDocument.of("doc", randomText(1000, 1)));

        assertEquals(List.of(0, 300, 600, 900), chunks.stream().map(Chunk::startOffset).toList());
        assertEquals(400, chunks.get(0).text().length());
        assertEquals(100, chunks.get(3).text().length());
    }

    @Test
    @DisplayName("Text not longer than the window yields exactly one chunk")
    void shortText() {
        String text = randomText(SIZE, 2);
        List<Chunk> chunks = chunker.chunk(SourceDocument.of("doc", text));

        assertEquals(1, chunks.size());
        assertEquals(0, chunks.get(0).startOffset());
        assertEquals(text, chunks.get(0).text());
        assertEquals("doc_00000000", chunks.get(0).chunkId());
    }

    @Test
    @DisplayName("Chunk count is ceil(length / step) for longer texts")
    void chunkCount() {
        for (int length : new int[]{401, 700, 701, 1000, 2345}) {
            List<Chunk> chunks = chunker.chunk(SourceDocument.of("doc", randomText(length, length)));
            int step = SIZE - OVERLAP;
            assertEquals((length + step - 1) / step, chunks.size(), "length " + length);
        }
    }

    @Test
    @DisplayName("Chunks cover the text completely, never exceed the window and never are empty")
    void coverage() {
        String text = randomText(5_432, 3);
        List<Chunk> chunks = chunker.chunk(SourceDocument.of("doc", text));

        for (Chunk c : chunks) {
            assertFalse(c.text().isEmpty());
            assertTrue(c.text().length() <= SIZE);
            assertEquals(text.substring(c.startOffset(), c.startOffset() + c.text().length()), c.text());
        }
        assertEquals(text, reconstruct(chunks));
    }

    @Test
    @DisplayName("Every chunk inherits the source metadata and adds its start offset")
    void metadataInheritance() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("publicationNumber", "JP2020-123456");
        metadata.put("path", "/corpus/a.txt");
        SourceDocument doc = new SourceDocument("JP2020-123456", randomText(900, 4), metadata);

        for (Chunk c : chunker.chunk(doc)) {
            assertEquals("JP2020-123456", c.metadata().get("publicationNumber"));
            assertEquals("/corpus/a.txt", c.metadata().get("path"));
            assertEquals(Integer.toString(c.startOffset()), c.metadata().get(Chunker.START_OFFSET_KEY));
            assertEquals(List.of("publicationNumber", "path", Chunker.START_OFFSET_KEY), List.copyOf(c.metadata().keySet()));
            assertEquals("JP2020-123456", c.sourceId());
        }
    }

    @Test
    @DisplayName("Chunking is deterministic")
    void deterministic() {
        SourceDocument doc = SourceDocument.of("doc", randomText(3_000, 5));
        assertEquals(chunker.chunk(doc), chunker.chunk(doc));
    }

    @Test
    @DisplayName("Empty text yields no chunks")
    void emptyText() {
        assertTrue(chunker.chunk(SourceDocument.of("doc", "")).isEmpty());
    }

    @Test
    @DisplayName("Chunk ids of one source sort by offset")
    void chunkIdsSortByOffset() {
        List<Chunk> chunks = new Chunker(20, 5).chunk(SourceDocument.of("doc", randomText(2_000, 6)));
        List<String> ids = chunks.stream().map(Chunk::chunkId).toList();
        assertEquals(ids.stream().sorted().toList(), ids);
    }

    @Test
    @DisplayName("Invalid size or overlap is rejected")
    void invalidParameters() {
        SourceDocument doc = SourceDocument.of("doc", "text");
        assertThrows(ConfigurationException.class, () -> chunker.chunk(doc, 100, 100));
        assertThrows(ConfigurationException.class, () -> chunker.chunk(doc, 100, 150));
        assertThrows(ConfigurationException.class, () -> chunker.chunk(doc, 100, -1));
        assertThrows(ConfigurationException.class, () -> chunker.chunk(doc, 0, 0));
        assertThrows(ConfigurationException.class, () -> new Chunker(10, 10));
    }

    @Test
    @DisplayName("Source metadata must not use the reserved start offset key")
    void reservedMetadataKey() {
        SourceDocument doc = new SourceDocument("doc", "text", Map.of(Chunker.START_OFFSET_KEY, "7"));
        assertThrows(ConfigurationException.class, () -> chunker.chunk(doc));
    }

    @Test
    @DisplayName("Chunk ids use ASCII digits whatever the default locale")
    void chunkIdsIgnoreLocale() {
        Locale previous = Locale.getDefault();
        try {
            for (Locale locale : new Locale[]{Locale.forLanguageTag("ar-EG"), Locale.forLanguageTag("th-TH-u-nu-thai")}) {
                Locale.setDefault(locale);
                assertEquals("A_00000300", Chunk.buildChunkId("A", 300));
                List<Chunk> chunks = chunker.chunk(SourceDocument.of("doc", randomText(1000, 7)));
                assertEquals("doc_00000900", chunks.get(3).chunkId(), locale.toLanguageTag());
            }
        } finally {
            Locale.setDefault(previous);
        }
    }
}
