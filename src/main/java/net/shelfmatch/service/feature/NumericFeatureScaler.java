package net.shelfmatch.service.feature;

/**
 * Standardizes one numeric column to zero mean and unit population variance.
 *
 * <p>A column with zero variance maps every value to 0.</p>
 */
public final class NumericFeatureScaler {

    private NumericFeatureScaler() {
    }

    public static double[] standardize(double[] values) {
        int n = values.length;
        double[] scaled = new double[n];
        if (n == 0) {
            return scaled;
        }
        double mean = 0.0;
        for (double value : values) {
            mean += value;
        }
        mean /= n;
        double variance = 0.0;
        for (double value : values) {
            double delta = value - mean;
            variance += delta * delta;
        }
        variance /= n;
        double std = Math.sqrt(variance);
        // rounding can leave a constant column with a tiny non-zero spread
        if (!Double.isFinite(std) || std <= 10 * Math.ulp(1.0) * Math.max(1.0, Math.abs(mean))) {
            return scaled;
        }
        for (int i = 0; i < n; i++) {
            scaled[i] = (values[i] - mean) / std;
        }
        return scaled;
    }
}
