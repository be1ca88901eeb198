package de.anton.cos.shift_monitor.model;

/**
 * Detector segments (FUV) and stripes (NUV) that appear in lamp-flash tables
 * and reference tables.
 */
public enum DetectorSegment {
    FUVA("FUV"),
    FUVB("FUV"),
    NUVA("NUV"),
    NUVB("NUV"),
    NUVC("NUV");

    private final String detector;

    DetectorSegment(String detector) {
        this.detector = detector;
    }

    /** @return the detector ("FUV" or "NUV") this segment belongs to. */
    public String getDetector() {
        return detector;
    }

    public boolean isFuv() {
        return "FUV".equals(detector);
    }

    /**
     * Finds a segment by its table name (case-insensitive, surrounding blanks ignored).
     *
     * @param name The segment name as stored in a FITS table, e.g. "FUVA".
     * @return The matching segment, or null if the name is null, blank or unknown.
     */
    public static DetectorSegment fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (DetectorSegment segment : values()) {
            if (segment.name().equalsIgnoreCase(trimmed)) {
                return segment;
            }
        }
        return null;
    }
}
