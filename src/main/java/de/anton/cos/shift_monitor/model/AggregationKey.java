package de.anton.cos.shift_monitor.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Grouping key of an {@link AggregationBucket}. The central wavelength and the
 * segment are null when the grouping does not use them.
 */
public record AggregationKey(String opticalElement, Integer centralWavelength, DetectorSegment segment)
        implements Comparable<AggregationKey> {

    private static final Comparator<AggregationKey> ORDER = Comparator
            .comparing(AggregationKey::opticalElement)
            .thenComparing(AggregationKey::centralWavelength, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AggregationKey::segment, Comparator.nullsFirst(Comparator.naturalOrder()));

    public AggregationKey {
        Objects.requireNonNull(opticalElement, "Optical element cannot be null.");
    }

    public static AggregationKey ofElement(String opticalElement) {
        return new AggregationKey(opticalElement, null, null);
    }

    public static AggregationKey ofCenwave(String opticalElement, int centralWavelength) {
        return new AggregationKey(opticalElement, centralWavelength, null);
    }

    public static AggregationKey ofSegment(String opticalElement, DetectorSegment segment) {
        return new AggregationKey(opticalElement, null, segment);
    }

    @Override
    public int compareTo(AggregationKey other) {
        return ORDER.compare(this, other);
    }

    /** Label used in reports, e.g. "G130M", "G130M/1291" or "G130M/FUVA". */
    public String label() {
        StringBuilder sb = new StringBuilder(opticalElement);
        if (centralWavelength != null) sb.append('/').append(centralWavelength);
        if (segment != null) sb.append('/').append(segment);
        return sb.toString();
    }
}
