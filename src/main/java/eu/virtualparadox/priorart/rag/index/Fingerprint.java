package eu.virtualparadox.priorart.rag.index;

import eu.virtualparadox.priorart.exception.ConfigurationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Configuration identity of an index snapshot. A snapshot may only be queried with
 * a fingerprint equal to the one it was built with.
 *
 * @param embeddingProviderId provider and model identity, see {@code Embedder#providerId()}
 * @param chunkSize           window length used by the chunker
 * @param chunkOverlap        overlap used by the chunker
 */
public record Fingerprint(String embeddingProviderId, int chunkSize, int chunkOverlap) {

    public Fingerprint {
        if (embeddingProviderId == null || embeddingProviderId.isBlank()) {
            throw new ConfigurationException("embeddingProviderId cannot be null or blank");
        }
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunkSize must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ConfigurationException("chunkOverlap must be non-negative and less than chunkSize");
        }
    }

    /**
     * Filesystem-safe, deterministic directory name:
     * <pre>
     *   {sanitized provider}-s{size}-o{overlap}-{8 hex chars of SHA-256}
     * </pre>
     * The hash keeps providers that sanitize to the same text apart.
     */
    public String storageKey() {
        final String sanitized = embeddingProviderId.replaceAll("[^A-Za-z0-9._-]", "_");
        return sanitized + "-s" + chunkSize + "-o" + chunkOverlap + "-" + shortHash();
    }

    private String shortHash() {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hash = digest.digest(toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
