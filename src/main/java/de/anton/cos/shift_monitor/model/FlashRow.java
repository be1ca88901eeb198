package de.anton.cos.shift_monitor.model;

/**
 * Raw row of a lamp-flash table, before correction and validation.
 *
 * @param segmentName Segment string as stored in the table.
 * @param shiftDisp   SHIFT_DISP, uncorrected.
 * @param shiftXdisp  SHIFT_XDISP.
 * @param specFound   SPEC_FOUND.
 */
public record FlashRow(String segmentName, double shiftDisp, double shiftXdisp, boolean specFound) {
}
