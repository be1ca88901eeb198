package de.anton.cos.shift_monitor.algorithms;

import java.util.Arrays;
import java.util.Collection;

/**
 * Small descriptive statistics used by the aggregation.
 */
public final class Statistics {

    private Statistics() { throw new IllegalStateException("Utility class"); }

    /**
     * Median of the finite values; NaN if there are none.
     * For an even count the mean of the two middle values is returned.
     */
    public static double median(Collection<Double> values) {
        double[] sorted = values.stream()
                .filter(v -> v != null && !Double.isNaN(v) && !Double.isInfinite(v))
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();
        int n = sorted.length;
        if (n == 0) {
            return Double.NaN;
        }
        return (n % 2 == 1) ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /** max - min of the finite values; NaN if there are none. */
    public static double range(double[] values) {
        double[] finite = Arrays.stream(values).filter(v -> !Double.isNaN(v) && !Double.isInfinite(v)).toArray();
        if (finite.length == 0) {
            return Double.NaN;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : finite) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return max - min;
    }
}
