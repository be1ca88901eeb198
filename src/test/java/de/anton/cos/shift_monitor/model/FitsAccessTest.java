package de.anton.cos.shift_monitor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FitsAccessTest {

    @Test
    void numericColumnsAreWidened() {
        assertArrayEquals(new double[] {1.5, -2.0}, FitsAccess.toDoubles(new float[] {1.5f, -2.0f}), 0.0);
        assertArrayEquals(new double[] {3.0, 4.0}, FitsAccess.toDoubles(new short[] {3, 4}), 0.0);
        assertArrayEquals(new double[] {5.0}, FitsAccess.toDoubles(new long[] {5L}), 0.0);
        assertArrayEquals(new int[] {1291, 1600}, FitsAccess.toInts(new short[] {1291, 1600}));
        assertArrayEquals(new int[] {3}, FitsAccess.toInts(new double[] {3.0}));
    }

    @Test
    void copiesAreReturned() {
        double[] column = {1.0, 2.0};
        double[] values = FitsAccess.toDoubles(column);
        values[0] = 99.0;
        assertEquals(1.0, column[0], 0.0);
    }

    @Test
    void stringCellsAreTrimmed() {
        assertArrayEquals(new String[] {"FUVA", "G130M", null}, FitsAccess.toStrings(new String[] {"FUVA  ", " G130M", null}));
    }

    @Test
    void logicalAndNumericFlags() {
        assertArrayEquals(new boolean[] {true, false}, FitsAccess.toBooleans(new boolean[] {true, false}));
        assertArrayEquals(new boolean[] {true, false}, FitsAccess.toBooleans(new Boolean[] {Boolean.TRUE, null}));
        assertArrayEquals(new boolean[] {false, true}, FitsAccess.toBooleans(new byte[] {0, 1}));
    }

    @Test
    void unsupportedColumnTypesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FitsAccess.toInts(new String[] {"1"}));
        assertThrows(IllegalArgumentException.class, () -> FitsAccess.toStrings(new int[] {1}));
    }
}
