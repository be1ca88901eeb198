package de.anton.cos.shift_monitor.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Piecewise-constant search-range envelope per optical element.
 */
public final class ToleranceEnvelope {

    /** SHIFT1 search range of the FUV gratings. */
    public static final double FUV_HALF_RANGE = 285.0;
    /** SHIFT1 search range of the NUV gratings before any re-centering. */
    public static final double NUV_HALF_RANGE = 58.0;
    /** Epoch of the G185M/G225M re-centering. */
    public static final double NUV_M_EPOCH = 56500.0;
    /** Epoch of the G230L re-centering. */
    public static final double G230L_EPOCH = 55535.0;

    private final Map<String, ToleranceBand> bands;

    public ToleranceEnvelope(Collection<ToleranceBand> bands) {
        Map<String, ToleranceBand> byElement = new LinkedHashMap<>();
        for (ToleranceBand band : bands) {
            byElement.put(band.opticalElement(), band);
        }
        this.bands = Collections.unmodifiableMap(byElement);
    }

    /** The envelope used by the COS shift monitor plots. */
    public static ToleranceEnvelope defaults() {
        SearchRange fuv = SearchRange.symmetric(FUV_HALF_RANGE);
        SearchRange nuv = SearchRange.symmetric(NUV_HALF_RANGE);
        return new ToleranceEnvelope(List.of(
                ToleranceBand.constant("G130M", fuv),
                ToleranceBand.constant("G160M", fuv),
                ToleranceBand.constant("G140L", fuv),
                new ToleranceBand("G185M", NUV_M_EPOCH, nuv, nuv.shiftedBy(-20)),
                new ToleranceBand("G225M", NUV_M_EPOCH, nuv, nuv.shiftedBy(-10)),
                ToleranceBand.constant("G285M", nuv),
                new ToleranceBand("G230L", G230L_EPOCH, nuv, nuv.shiftedBy(-40))));
    }

    public Optional<ToleranceBand> bandFor(String opticalElement) {
        return Optional.ofNullable(bands.get(opticalElement));
    }

    /** @return the range for the element at the given MJD, empty if the element has no band. */
    public Optional<SearchRange> rangeAt(String opticalElement, double mjd) {
        return bandFor(opticalElement).map(band -> band.rangeAt(mjd));
    }

    public Collection<ToleranceBand> getBands() {
        return bands.values();
    }
}
