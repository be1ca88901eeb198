package de.anton.cos.shift_monitor.model;

/**
 * Closed interval [lower, upper] of acceptable SHIFT1 values in pixels.
 */
public record SearchRange(double lower, double upper) {
    public SearchRange {
        if (lower > upper) {
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
    }

    public static SearchRange symmetric(double halfWidth) {
        return new SearchRange(-halfWidth, halfWidth);
    }

    /** The same range moved by {@code offset} pixels. */
    public SearchRange shiftedBy(double offset) {
        return new SearchRange(lower + offset, upper + offset);
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
