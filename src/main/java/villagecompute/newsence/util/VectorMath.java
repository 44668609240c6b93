package villagecompute.newsence.util;

/**
 * Vector helpers for item embeddings.
 */
public final class VectorMath {

    private VectorMath() {
        // Utility class, no instantiation
    }

    /**
     * Whether every component is zero. Such a vector has no direction and cannot be normalized.
     */
    public static boolean isZero(float[] vector) {
        for (float v : vector) {
            if (v != 0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Scales a vector to unit length. A zero vector is returned unchanged.
     *
     * @param vector
     *            raw embedding
     * @return new L2-normalized array
     */
    public static float[] l2Normalize(float[] vector) {
        double sumSquares = 0.0;
        for (float v : vector) {
            sumSquares += (double) v * v;
        }
        double norm = Math.sqrt(sumSquares);
        float[] result = new float[vector.length];
        if (norm == 0.0) {
            System.arraycopy(vector, 0, result, 0, vector.length);
            return result;
        }
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    /**
     * Cosine similarity of two equal-length vectors; 0 when either has zero norm.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
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
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
