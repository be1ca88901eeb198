package de.anton.cos.shift_monitor.algorithms;

import de.anton.cos.shift_monitor.model.LinearFit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordinary least-squares fit of a straight line, with the standard error of the
 * slope estimated from the residuals.
 */
public final class LinearRegression {

    private static final Logger logger = LoggerFactory.getLogger(LinearRegression.class);
    private static final double MIN_VARIANCE = 1e-12;

    private LinearRegression() { throw new IllegalStateException("Utility class"); }

    /**
     * Fits y = a*x + b.
     *
     * @param x Abscissae.
     * @param y Ordinates, same length as x.
     * @return The fit, or null if there are fewer than two points or all x are equal.
     */
    public static LinearFit fit(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length) {
            throw new IllegalArgumentException("x and y must be non-null and of equal length.");
        }
        int n = x.length;
        if (n < 2) {
            logger.debug("Linear fit skipped: {} point(s).", n);
            return null;
        }

        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        // Centered sums keep precision for MJD-sized abscissae
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            sxx += dx * dx;
            sxy += dx * (y[i] - meanY);
        }
        if (sxx < MIN_VARIANCE) {
            logger.debug("Linear fit skipped: abscissae are constant.");
            return null;
        }

        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double slopeError = Double.NaN;
        if (n > 2) {
            double sse = 0.0;
            for (int i = 0; i < n; i++) {
                double residual = y[i] - (slope * x[i] + intercept);
                sse += residual * residual;
            }
            slopeError = Math.sqrt(sse / (n - 2) / sxx);
        }
        return new LinearFit(slope, intercept, slopeError, n);
    }
}
