package de.anton.cos.shift_monitor.model;

/**
 * Ordinary least-squares line y = slope * x + intercept.
 *
 * @param slope              Fitted slope (pixels per day for shift trends).
 * @param intercept          Fitted intercept.
 * @param slopeStandardError Standard error of the slope from the residuals, NaN for fewer than three points.
 * @param pointCount         Number of points the fit is based on.
 */
public record LinearFit(double slope, double intercept, double slopeStandardError, int pointCount) {

    public double valueAt(double x) {
        return slope * x + intercept;
    }

    @Override
    public String toString() {
        return String.format("LinearFit[slope=%.5f +/- %.5f, intercept=%.5f, n=%d]", slope, slopeStandardError, intercept, pointCount);
    }
}
