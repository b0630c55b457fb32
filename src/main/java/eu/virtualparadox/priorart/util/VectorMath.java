package eu.virtualparadox.priorart.util;

public final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * L2-normalizes {@code vec} in place. A zero vector is left untouched.
     */
    public static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }

    /**
     * Cosine similarity in {@code [-1, 1]}; 0 when either vector has zero norm.
     *
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double cosine(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        final double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push identical vectors marginally past 1
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
