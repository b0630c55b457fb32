package eu.virtualparadox.priorart.rag.embed;

import eu.virtualparadox.priorart.util.VectorMath;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Model-free embedder based on the hashing trick.
 * <p>
 * Lower-cased, whitespace-collapsed text is cut into character n-grams
 * ({@value #MIN_GRAM}..{@value #MAX_GRAM}); every n-gram is hashed into one of
 * {@code dimension} buckets with a hash-derived sign, and the result is L2-normalized.
 * Character n-grams work for languages without word separators (Japanese patent text),
 * and texts sharing many n-grams end up with a high cosine similarity.
 * </p>
 * <p>Deterministic and thread-safe; useful offline and as a reference provider in tests.</p>
 */
public final class HashingEmbeddingService implements Embedder {

    private static final int MIN_GRAM = 1;
    private static final int MAX_GRAM = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int dimension;
    private final String providerId;

    public HashingEmbeddingService(final int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.providerId = EmbeddingProvider.HASHING.providerId("dim" + dimension);
    }

    @Override
    public float[] embed(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        final String normalized = WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();

        final float[] vector = new float[dimension];
        for (int n = MIN_GRAM; n <= MAX_GRAM; n++) {
            for (int i = 0; i + n <= normalized.length(); i++) {
                final int hash = mix(31 * normalized.substring(i, i + n).hashCode() + n);
                final int bucket = Math.floorMod(hash, dimension);
                vector[bucket] += ((hash >>> 31) == 0) ? 1.0f : -1.0f;
            }
        }
        VectorMath.normalize(vector);
        return vector;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Murmur3 finalizer; spreads String.hashCode() over all bits before bucketing.
     */
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
