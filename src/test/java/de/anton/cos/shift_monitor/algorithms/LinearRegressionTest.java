package de.anton.cos.shift_monitor.algorithms;

import de.anton.cos.shift_monitor.model.LinearFit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearRegressionTest {

    @Test
    void exactLineHasZeroError() {
        LinearFit fit = LinearRegression.fit(new double[] {56000, 56001, 56002, 56003}, new double[] {1, 3, 5, 7});

        assertEquals(2.0, fit.slope(), 1e-9);
        assertEquals(1.0 - 2.0 * 56000, fit.intercept(), 1e-6);
        assertEquals(0.0, fit.slopeStandardError(), 1e-9);
        assertEquals(4, fit.pointCount());
        assertEquals(9.0, fit.valueAt(56004), 1e-6);
    }

    @Test
    void slopeErrorFromResiduals() {
        LinearFit fit = LinearRegression.fit(new double[] {0, 1, 2, 3}, new double[] {1, 0, 2, 3});

        assertEquals(0.8, fit.slope(), 1e-12);
        assertEquals(0.3, fit.intercept(), 1e-12);
        // sse = 1.8, sxx = 5
        assertEquals(Math.sqrt(1.8 / 2 / 5), fit.slopeStandardError(), 1e-12);
    }

    @Test
    void twoPointsHaveNoError() {
        LinearFit fit = LinearRegression.fit(new double[] {1, 2}, new double[] {1, 2});
        assertEquals(1.0, fit.slope(), 1e-12);
        assertTrue(Double.isNaN(fit.slopeStandardError()));
    }

    @Test
    void degenerateInputHasNoFit() {
        assertNull(LinearRegression.fit(new double[] {1}, new double[] {1}));
        assertNull(LinearRegression.fit(new double[] {5, 5, 5}, new double[] {1, 2, 3}));
        assertThrows(IllegalArgumentException.class, () -> LinearRegression.fit(new double[] {1, 2}, new double[] {1}));
    }
}
