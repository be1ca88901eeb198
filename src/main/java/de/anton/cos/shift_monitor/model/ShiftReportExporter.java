package de.anton.cos.shift_monitor.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Exports the monitor results to an Excel workbook (.xlsx) with the sheets
 * {@value #SHEET_TRENDS}, {@value #SHEET_DIFFERENCES} and {@value #SHEET_ANOMALIES}.
 */
public class ShiftReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(ShiftReportExporter.class);

    public static final String SHEET_TRENDS = "Trends";
    public static final String SHEET_DIFFERENCES = "Differences";
    public static final String SHEET_ANOMALIES = "Anomalies";

    private static final List<String> TREND_COLUMNS = List.of("Bucket", "OPT_ELEM", "CENWAVE", "SEGMENT", "Records", "Days", "Slope (px/day)", "Slope error", "Intercept", "First MJD", "Last MJD");
    private static final List<String> DIFFERENCE_COLUMNS = List.of("CENWAVE", "Dataset", "MJD", "OPT_ELEM", "FPPOS", "SHIFT1A", "SHIFT1B", "A - B");
    private static final List<String> ANOMALY_COLUMNS = List.of("Kind", "Source", "Segment", "Value", "Lower", "Upper", "MJD");
    private static final int COLUMN_WIDTH = 16 * 256;

    /**
     * Writes the workbook, replacing an existing file.
     *
     * @param buckets     Aggregation buckets, one Trends row each.
     * @param differences A/B differences per central wavelength.
     * @param anomalies   Flagged values.
     * @param file        Target file.
     */
    public void export(Collection<AggregationBucket> buckets, Map<Integer, List<SegmentDifference>> differences,
                       List<Anomaly> anomalies, Path file) throws IOException {
        if (file == null) { throw new IllegalArgumentException("Output file cannot be null."); }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) { Files.createDirectories(parent); }

        logger.info("Starting Excel export to: {}", file);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Font headerFont = workbook.createFont(); headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle(); headerStyle.setFont(headerFont);

            Sheet trends = createSheet(workbook, SHEET_TRENDS, TREND_COLUMNS, headerStyle);
            int rowNum = 1;
            for (AggregationBucket bucket : buckets) {
                Row row = trends.createRow(rowNum++); int c = 0;
                AggregationKey key = bucket.getKey();
                row.createCell(c++).setCellValue(key.label());
                row.createCell(c++).setCellValue(key.opticalElement());
                if (key.centralWavelength() != null) { row.createCell(c++).setCellValue(key.centralWavelength()); } else { row.createCell(c++, CellType.BLANK); }
                row.createCell(c++).setCellValue(key.segment() == null ? "" : key.segment().name());
                row.createCell(c++).setCellValue(bucket.getRecords().size());
                row.createCell(c++).setCellValue(bucket.getDailyMedians().size());
                LinearFit fit = bucket.getFit();
                createNumericCell(row, c++, fit == null ? Double.NaN : fit.slope());
                createNumericCell(row, c++, fit == null ? Double.NaN : fit.slopeStandardError());
                createNumericCell(row, c++, fit == null ? Double.NaN : fit.intercept());
                List<MeasuredShiftRecord> records = bucket.getRecords();
                createNumericCell(row, c++, records.isEmpty() ? Double.NaN : records.get(0).exposureStart());
                createNumericCell(row, c++, records.isEmpty() ? Double.NaN : records.get(records.size() - 1).exposureStart());
            }

            Sheet diffs = createSheet(workbook, SHEET_DIFFERENCES, DIFFERENCE_COLUMNS, headerStyle);
            rowNum = 1;
            for (List<SegmentDifference> perCenwave : differences.values()) {
                for (SegmentDifference d : perCenwave) {
                    Row row = diffs.createRow(rowNum++); int c = 0;
                    row.createCell(c++).setCellValue(d.centralWavelength()); row.createCell(c++).setCellValue(d.dataset());
                    createNumericCell(row, c++, d.mjd()); row.createCell(c++).setCellValue(d.opticalElement()); row.createCell(c++).setCellValue(d.fpPosition());
                    createNumericCell(row, c++, d.aShift()); createNumericCell(row, c++, d.bShift()); createNumericCell(row, c++, d.difference());
                }
            }

            Sheet anomalySheet = createSheet(workbook, SHEET_ANOMALIES, ANOMALY_COLUMNS, headerStyle);
            rowNum = 1;
            for (Anomaly a : anomalies) {
                Row row = anomalySheet.createRow(rowNum++); int c = 0;
                row.createCell(c++).setCellValue(a.kind().name()); row.createCell(c++).setCellValue(a.source());
                row.createCell(c++).setCellValue(a.segment() == null ? "" : a.segment().name());
                createNumericCell(row, c++, a.value()); createNumericCell(row, c++, a.lower()); createNumericCell(row, c++, a.upper()); createNumericCell(row, c++, a.mjd());
            }

            logger.debug("Writing workbook to file..."); workbook.write(out);
            logger.info("Excel export completed: {} buckets, {} cenwaves with differences, {} anomalies -> {}", buckets.size(), differences.size(), anomalies.size(), file);
        } catch (IOException e) { logger.error("IOException during Excel export to {}", file, e); throw e; }
        catch (RuntimeException e) { logger.error("Unexpected error during Excel export to {}", file, e); throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e); }
    }

    private Sheet createSheet(Workbook workbook, String name, List<String> columns, CellStyle headerStyle) {
        Sheet sheet = workbook.createSheet(name);
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) { Cell cell = headerRow.createCell(i); cell.setCellValue(columns.get(i)); cell.setCellStyle(headerStyle); sheet.setColumnWidth(i, COLUMN_WIDTH); }
        return sheet;
    }

    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}
