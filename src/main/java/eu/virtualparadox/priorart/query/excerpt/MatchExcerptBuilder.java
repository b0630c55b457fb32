package eu.virtualparadox.priorart.query.excerpt;

import eu.virtualparadox.priorart.exception.ConfigurationException;
import eu.virtualparadox.priorart.ingest.model.SourceDocument;
import eu.virtualparadox.priorart.query.model.RetrievalResult;
import org.springframework.stereotype.Component;

/**
 * Cuts the matched chunk out of its source text, with up to {@code contextChars}
 * characters on each side, using the {@code startOffset} provenance of the result.
 */
@Component
public class MatchExcerptBuilder {

    /**
     * @throws IllegalArgumentException if the result does not belong to {@code document}
     *                                  or its text is not found at the recorded offset
     */
    public MatchExcerpt excerpt(final SourceDocument document, final RetrievalResult result, final int contextChars) {
        if (contextChars < 0) {
            throw new ConfigurationException("contextChars must not be negative, got " + contextChars);
        }
        if (!document.id().equals(result.sourceId())) {
            throw new IllegalArgumentException("Result " + result.chunkId() + " belongs to " + result.sourceId()
                    + ", not to " + document.id());
        }
        final int start = result.startOffset()
                .orElseThrow(() -> new IllegalArgumentException("Result " + result.chunkId() + " carries no start offset"));

        final String text = document.text();
        final int end = start + result.text().length();
        if (start < 0 || end > text.length() || !text.startsWith(result.text(), start)) {
            throw new IllegalArgumentException("Chunk " + result.chunkId() + " is not found at offset " + start
                    + " of " + document.id());
        }

        final int from = Math.max(0, start - contextChars);
        final int to = Math.min(text.length(), end + contextChars);
        return new MatchExcerpt(document.id(), start,
                text.substring(from, start),
                text.substring(start, end),
                text.substring(end, to));
    }
}
