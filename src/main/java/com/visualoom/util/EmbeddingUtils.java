package com.visualoom.util;

/**
 * Vector helpers for cosine similarity over embeddings.
 */
public final class EmbeddingUtils {

    private static final double EPSILON = 1e-10;

    private EmbeddingUtils() {
    }

    /**
     * Euclidean length of a vector, accumulated in double precision.
     */
    public static double norm(float[] vector) {
        double sumOfSquares = 0.0;
        for (float v : vector) {
            sumOfSquares += (double) v * v;
        }
        return Math.sqrt(sumOfSquares);
    }

    /**
     * Returns a unit-length copy of the vector. A zero vector is returned as a
     * zero copy.
     */
    public static float[] l2Normalize(float[] vector) {
        float[] copy = vector.clone();
        double magnitude = norm(vector);
        if (magnitude < EPSILON) {
            return copy;
        }
        for (int i = 0; i < copy.length; i++) {
            copy[i] = (float) (vector[i] / magnitude);
        }
        return copy;
    }

    /**
     * Cosine similarity of two vectors of equal length, in [-1, 1]. Both sides
     * are normalised here, so inputs need not be unit length. Returns 0 when
     * either vector is zero.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have the same length: " + a.length + " vs " + b.length);
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA < EPSILON || normB < EPSILON) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot / (normA * normB);
    }
}
