package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.algorithms.LinearRegression;
import de.anton.cos.shift_monitor.algorithms.Statistics;
import de.anton.cos.shift_monitor.model.AggregationBucket;
import de.anton.cos.shift_monitor.model.AggregationKey;
import de.anton.cos.shift_monitor.model.DailyMedian;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.LinearFit;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.SegmentDifference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Groups the measured shifts of the whole corpus by instrument configuration and
 * reduces every group to a per-day median series with a linear trend. Also pairs
 * the FUVA and FUVB measurement of each FUV dataset.
 * This class holds no state besides its configuration.
 */
public class ShiftAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ShiftAggregator.class);

    private static final Comparator<MeasuredShiftRecord> BY_TIME = Comparator.comparingDouble(MeasuredShiftRecord::exposureStart);

    /** Element name of the combined bucket of all NUV gratings. */
    public static final String ALL_NUV = "All NUV";
    public static final Set<String> NUV_GRATINGS = Set.of("G185M", "G225M", "G285M", "G230L");
    private static final AggregationKey ALL_NUV_KEY = AggregationKey.ofElement(ALL_NUV);

    /**
     * Result of a full aggregation run.
     */
    public static class AggregationResult {
        public final SortedMap<AggregationKey, AggregationBucket> byElement;
        public final SortedMap<AggregationKey, AggregationBucket> bySegment;
        public final SortedMap<AggregationKey, AggregationBucket> byCenwave;
        public final SortedMap<Integer, List<SegmentDifference>> differences;
        public final SortedMap<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> relations;

        private AggregationResult(SortedMap<AggregationKey, AggregationBucket> byElement,
                                  SortedMap<AggregationKey, AggregationBucket> bySegment,
                                  SortedMap<AggregationKey, AggregationBucket> byCenwave,
                                  SortedMap<Integer, List<SegmentDifference>> differences,
                                  SortedMap<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> relations) {
            this.byElement = Collections.unmodifiableSortedMap(byElement);
            this.bySegment = Collections.unmodifiableSortedMap(bySegment);
            this.byCenwave = Collections.unmodifiableSortedMap(byCenwave);
            this.differences = Collections.unmodifiableSortedMap(differences);
            this.relations = Collections.unmodifiableSortedMap(relations);
        }
    }

    private final Set<String> positiveOnlyElements;

    public ShiftAggregator(MonitorConfiguration config) {
        this(config.positiveOnlyElements());
    }

    /**
     * @param positiveOnlyElements Optical elements whose non-positive SHIFT1 values are
     *                             discarded (the mirrors report 0 when no spectrum was found).
     */
    public ShiftAggregator(Set<String> positiveOnlyElements) {
        this.positiveOnlyElements = Set.copyOf(Objects.requireNonNull(positiveOnlyElements, "Element set cannot be null."));
    }

    /** Runs all groupings and the segment pairing over the same records. */
    public AggregationResult aggregate(List<MeasuredShiftRecord> records) {
        logger.info("Service: Aggregating {} shift records.", records.size());
        AggregationResult result = new AggregationResult(
                groupByElement(records), groupBySegment(records), groupByCenwave(records),
                segmentDifferences(records), shiftRelations(records));
        logger.info("Service: {} element, {} segment and {} cenwave buckets; {} cenwaves with A-B differences.",
                result.byElement.size(), result.bySegment.size(), result.byCenwave.size(), result.differences.size());
        return result;
    }

    /** Buckets per optical element, plus the {@value #ALL_NUV} bucket over {@link #NUV_GRATINGS}. */
    public SortedMap<AggregationKey, AggregationBucket> groupByElement(List<MeasuredShiftRecord> records) {
        SortedMap<AggregationKey, AggregationBucket> buckets = group(records, r -> AggregationKey.ofElement(r.opticalElement()));
        buckets.putAll(group(records, r -> NUV_GRATINGS.contains(r.opticalElement()) ? ALL_NUV_KEY : null));
        return buckets;
    }

    /** Buckets per (optical element, segment); records without a segment are left out. */
    public SortedMap<AggregationKey, AggregationBucket> groupBySegment(List<MeasuredShiftRecord> records) {
        return group(records, r -> r.segment() == null ? null : AggregationKey.ofSegment(r.opticalElement(), r.segment()));
    }

    /** Buckets per (optical element, central wavelength). */
    public SortedMap<AggregationKey, AggregationBucket> groupByCenwave(List<MeasuredShiftRecord> records) {
        return group(records, r -> AggregationKey.ofCenwave(r.opticalElement(), r.centralWavelength()));
    }

    /**
     * Pairs the first FUVA and the first FUVB row of every FUV dataset. Datasets missing
     * one side, or with a missing SHIFT1 on either side, are skipped.
     *
     * @return Differences per central wavelength, datasets in name order.
     */
    public SortedMap<Integer, List<SegmentDifference>> segmentDifferences(List<MeasuredShiftRecord> records) {
        Map<String, List<MeasuredShiftRecord>> byDataset = records.stream()
                .filter(r -> "FUV".equalsIgnoreCase(r.detector()))
                .collect(Collectors.groupingBy(MeasuredShiftRecord::dataset, TreeMap::new, Collectors.toList()));

        SortedMap<Integer, List<SegmentDifference>> result = new TreeMap<>();
        int skipped = 0;
        for (Map.Entry<String, List<MeasuredShiftRecord>> entry : byDataset.entrySet()) {
            MeasuredShiftRecord a = firstOf(entry.getValue(), DetectorSegment.FUVA);
            MeasuredShiftRecord b = firstOf(entry.getValue(), DetectorSegment.FUVB);
            if (a == null || b == null || !a.hasDispersionShift() || !b.hasDispersionShift()) {
                logger.debug("No A/B pair for dataset {}", entry.getKey());
                skipped++;
                continue;
            }
            SegmentDifference difference = new SegmentDifference(entry.getKey(), a.opticalElement(), a.centralWavelength(),
                    a.focalPlanePosition() == null ? 0 : a.focalPlanePosition(), a.exposureStart(),
                    a.dispersionShift(), b.dispersionShift());
            result.computeIfAbsent(a.centralWavelength(), k -> new ArrayList<>()).add(difference);
        }
        logger.debug("Segment differences: {} datasets paired, {} skipped.", byDataset.size() - skipped, skipped);
        return result;
    }

    /**
     * SHIFT1/SHIFT2 pairs per central wavelength and segment, in time order. Records
     * without a segment or without both shifts are left out.
     */
    public SortedMap<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> shiftRelations(List<MeasuredShiftRecord> records) {
        SortedMap<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> result = new TreeMap<>();
        records.stream()
                .filter(r -> r.segment() != null && r.hasDispersionShift() && r.hasCrossDispersionShift())
                .sorted(BY_TIME)
                .forEach(r -> result.computeIfAbsent(r.centralWavelength(), k -> new TreeMap<>())
                        .computeIfAbsent(r.segment(), k -> new ArrayList<>())
                        .add(r));
        return result;
    }

    private static MeasuredShiftRecord firstOf(List<MeasuredShiftRecord> records, DetectorSegment segment) {
        for (MeasuredShiftRecord r : records) {
            if (r.segment() == segment) {
                return r;
            }
        }
        return null;
    }

    /** Groups usable records by key (null key = not part of this grouping) and builds a bucket per key. */
    private SortedMap<AggregationKey, AggregationBucket> group(List<MeasuredShiftRecord> records,
                                                               Function<MeasuredShiftRecord, AggregationKey> keyFunction) {
        SortedMap<AggregationKey, List<MeasuredShiftRecord>> members = new TreeMap<>();
        for (MeasuredShiftRecord r : records) {
            if (!isUsable(r)) {
                continue;
            }
            AggregationKey key = keyFunction.apply(r);
            if (key != null) {
                members.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
            }
        }
        SortedMap<AggregationKey, AggregationBucket> buckets = new TreeMap<>();
        members.forEach((key, list) -> buckets.put(key, buildBucket(key, list)));
        return buckets;
    }

    private boolean isUsable(MeasuredShiftRecord r) {
        if (!r.hasDispersionShift()) {
            return false;
        }
        return !positiveOnlyElements.contains(r.opticalElement()) || r.dispersionShift() > 0;
    }

    private AggregationBucket buildBucket(AggregationKey key, List<MeasuredShiftRecord> members) {
        List<MeasuredShiftRecord> ordered = new ArrayList<>(members);
        ordered.sort(BY_TIME);

        SortedMap<Integer, List<Double>> perDay = new TreeMap<>();
        for (MeasuredShiftRecord r : ordered) {
            perDay.computeIfAbsent(r.day(), d -> new ArrayList<>()).add(r.dispersionShift());
        }
        List<DailyMedian> medians = new ArrayList<>(perDay.size());
        perDay.forEach((day, values) -> medians.add(new DailyMedian(day, Statistics.median(values), values.size())));

        double[] x = medians.stream().mapToDouble(DailyMedian::day).toArray();
        double[] y = medians.stream().mapToDouble(DailyMedian::median).toArray();
        LinearFit fit = LinearRegression.fit(x, y);

        AggregationBucket bucket = new AggregationBucket(key, ordered, medians, fit);
        logger.debug("{}", bucket);
        return bucket;
    }
}
