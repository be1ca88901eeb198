package de.anton.cos.shift_monitor.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Records sharing one instrument configuration, with their per-day median
 * series and the trend fitted to it.
 */
public final class AggregationBucket {

    private final AggregationKey key;
    private final List<MeasuredShiftRecord> records;
    private final List<DailyMedian> dailyMedians;
    private final LinearFit fit;

    /**
     * @param key          Grouping key.
     * @param records      Member records ordered by exposure start.
     * @param dailyMedians Per-day medians ordered by day.
     * @param fit          Trend of the daily medians, null if it could not be fitted.
     */
    public AggregationBucket(AggregationKey key, List<MeasuredShiftRecord> records,
                             List<DailyMedian> dailyMedians, LinearFit fit) {
        this.key = Objects.requireNonNull(key, "Bucket key cannot be null.");
        this.records = records == null ? Collections.emptyList() : List.copyOf(records);
        this.dailyMedians = dailyMedians == null ? Collections.emptyList() : List.copyOf(dailyMedians);
        this.fit = fit;
    }

    public AggregationKey getKey() { return key; }
    public List<MeasuredShiftRecord> getRecords() { return records; }
    public List<DailyMedian> getDailyMedians() { return dailyMedians; }
    /** @return the trend fit, or null for fewer than two distinct days. */
    public LinearFit getFit() { return fit; }
    public boolean hasFit() { return fit != null; }

    @Override
    public String toString() {
        return String.format("AggregationBucket[%s, records=%d, days=%d, fit=%s]",
                key.label(), records.size(), dailyMedians.size(), fit);
    }
}
