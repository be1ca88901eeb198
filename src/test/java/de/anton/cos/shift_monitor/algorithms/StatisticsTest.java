package de.anton.cos.shift_monitor.algorithms;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsTest {

    @Test
    void medianOddAndEven() {
        assertEquals(3.0, Statistics.median(List.of(5.0, 1.0, 3.0)), 0.0);
        assertEquals(2.5, Statistics.median(List.of(4.0, 1.0, 2.0, 3.0)), 0.0);
    }

    @Test
    void medianIgnoresNonFinite() {
        assertEquals(2.0, Statistics.median(Arrays.asList(2.0, Double.NaN, null)), 0.0);
        assertTrue(Double.isNaN(Statistics.median(List.of())));
    }

    @Test
    void range() {
        assertEquals(0.8, Statistics.range(new double[] {0.5, -0.3, 0.1}), 1e-12);
        assertEquals(0.0, Statistics.range(new double[] {1.0}), 0.0);
        assertTrue(Double.isNaN(Statistics.range(new double[] {Double.NaN})));
    }
}
