package de.anton.cos.shift_monitor.model;

import de.anton.cos.shift_monitor.exception.MissingRequiredFieldException;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.TableHDU;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Helpers for reading header keywords and table columns with nom-tam-fits.
 * Column names are matched case-insensitively and numeric columns are widened
 * to double/int regardless of their stored FITS type.
 */
public final class FitsAccess {

    private FitsAccess() { throw new IllegalStateException("Utility class"); }

    /** @return the index of the named column, or -1 if the table has no such column. */
    public static int findColumn(TableHDU<?> table, String name) {
        for (int i = 0; i < table.getNCols(); i++) {
            String columnName = table.getColumnName(i);
            if (columnName != null && columnName.trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    public static boolean hasColumn(TableHDU<?> table, String name) {
        return findColumn(table, name) >= 0;
    }

    /** Reads a column by name; a missing column is reported as a missing field of {@code file}. */
    public static Object requireColumn(TableHDU<?> table, String name, Path file) throws MissingRequiredFieldException, FitsException {
        int index = findColumn(table, name);
        if (index < 0) {
            throw new MissingRequiredFieldException(file, name);
        }
        return table.getColumn(index);
    }

    public static double[] toDoubles(Object column) {
        if (column instanceof double[]) {
            return ((double[]) column).clone();
        }
        if (column instanceof float[]) {
            float[] src = (float[]) column;
            double[] values = new double[src.length];
            for (int i = 0; i < src.length; i++) values[i] = src[i];
            return values;
        }
        if (column instanceof long[]) {
            return Arrays.stream((long[]) column).asDoubleStream().toArray();
        }
        int[] ints = toInts(column);
        return Arrays.stream(ints).asDoubleStream().toArray();
    }

    public static int[] toInts(Object column) {
        if (column instanceof int[]) {
            return ((int[]) column).clone();
        }
        if (column instanceof short[]) {
            short[] src = (short[]) column;
            int[] values = new int[src.length];
            for (int i = 0; i < src.length; i++) values[i] = src[i];
            return values;
        }
        if (column instanceof byte[]) {
            byte[] src = (byte[]) column;
            int[] values = new int[src.length];
            for (int i = 0; i < src.length; i++) values[i] = src[i];
            return values;
        }
        if (column instanceof long[]) {
            return Arrays.stream((long[]) column).mapToInt(Math::toIntExact).toArray();
        }
        if (column instanceof double[]) {
            return Arrays.stream((double[]) column).mapToInt(v -> (int) v).toArray();
        }
        if (column instanceof float[]) {
            float[] src = (float[]) column;
            int[] values = new int[src.length];
            for (int i = 0; i < src.length; i++) values[i] = (int) src[i];
            return values;
        }
        throw unsupported(column);
    }

    /** String columns come back as String[]; cells are trimmed. */
    public static String[] toStrings(Object column) {
        if (!(column instanceof String[])) {
            throw unsupported(column);
        }
        String[] src = (String[]) column;
        String[] values = new String[src.length];
        for (int i = 0; i < src.length; i++) {
            values[i] = src[i] == null ? null : src[i].trim();
        }
        return values;
    }

    /** Logical columns come back as boolean[] (or Boolean[]); numeric flags are true when non-zero. */
    public static boolean[] toBooleans(Object column) {
        if (column instanceof boolean[]) {
            return ((boolean[]) column).clone();
        }
        if (column instanceof Boolean[]) {
            Boolean[] src = (Boolean[]) column;
            boolean[] values = new boolean[src.length];
            for (int i = 0; i < src.length; i++) values[i] = Boolean.TRUE.equals(src[i]);
            return values;
        }
        int[] flags = toInts(column);
        boolean[] values = new boolean[flags.length];
        for (int i = 0; i < flags.length; i++) values[i] = flags[i] != 0;
        return values;
    }

    private static IllegalArgumentException unsupported(Object column) {
        return new IllegalArgumentException("Unsupported column type: " + (column == null ? "null" : column.getClass().getSimpleName()));
    }

    public static String requireString(Header header, String key, Path file) throws MissingRequiredFieldException {
        String value = header.containsKey(key) ? header.getStringValue(key) : null;
        if (value == null) {
            throw new MissingRequiredFieldException(file, key);
        }
        return value.trim();
    }

    public static int requireInt(Header header, String key, Path file) throws MissingRequiredFieldException {
        if (!header.containsKey(key)) {
            throw new MissingRequiredFieldException(file, key);
        }
        return header.getIntValue(key);
    }

    public static double requireDouble(Header header, String key, Path file) throws MissingRequiredFieldException {
        if (!header.containsKey(key)) {
            throw new MissingRequiredFieldException(file, key);
        }
        return header.getDoubleValue(key);
    }

    /** @return the keyword value, or null when the header does not carry it. */
    public static Integer optionalInt(Header header, String key) {
        return header.containsKey(key) ? header.getIntValue(key) : null;
    }

    public static String optionalString(Header header, String key) {
        String value = header.containsKey(key) ? header.getStringValue(key) : null;
        return value == null ? null : value.trim();
    }
}
