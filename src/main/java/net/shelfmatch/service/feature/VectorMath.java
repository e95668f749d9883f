package net.shelfmatch.service.feature;

/**
 * Dense vector helpers shared by the vectorizer and the feature matrix.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Scales the vector in place to unit length; a zero vector is left unchanged.
     */
    static void normalizeInPlace(double[] vector) {
        double norm = norm(vector);
        if (norm == 0.0) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
