package de.anton.cos.shift_monitor.model;

/**
 * Median dispersion shift of all measurements taken on one integer MJD.
 *
 * @param day    Integer MJD.
 * @param median Median SHIFT1 in pixels.
 * @param count  Number of measurements on that day.
 */
public record DailyMedian(int day, double median, int count) {
}
