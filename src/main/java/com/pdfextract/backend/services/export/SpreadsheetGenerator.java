package com.pdfextract.backend.services.export;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import com.pdfextract.backend.config.StorageProperties;
import com.pdfextract.backend.services.consolidation.ConsolidatedTable;
import com.pdfextract.backend.services.consolidation.SummaryStatistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a consolidated table to a formatted .xlsx workbook in the output directory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpreadsheetGenerator {

    public static final String DATA_SHEET = "Extracted Data";
    public static final String SUMMARY_SHEET = "Summary";

    static final int MAX_COLUMN_WIDTH = 50;
    // Excel cell text limit; POI rejects anything longer.
    static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    private static final String INVALID_CHARS = "<>:\"/\\|?*";
    private static final byte[] HEADER_FILL_RGB = {(byte) 0x36, (byte) 0x60, (byte) 0x92};

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FALLBACK_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StorageProperties storageProperties;

    public Path generate(ConsolidatedTable table, String name) {
        return generate(table, name, false, null);
    }

    /**
     * Writes {@code table} to {@code <output-dir>/<sanitized name>.xlsx}. With {@code includeSummary}
     * and statistics present, a "Summary" sheet is placed before the data sheet. Formatting problems
     * are logged; the data is written regardless.
     */
    public Path generate(ConsolidatedTable table, String name, boolean includeSummary, SummaryStatistics summary) {
        String fileName = sanitizeName(name);
        Path outputDir = Paths.get(storageProperties.getOutputDir()).toAbsolutePath().normalize();
        Path target = outputDir.resolve(fileName + ".xlsx");
        long startMs = System.currentTimeMillis();

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(DATA_SHEET);
            writeData(sheet, table);
            formatDataSheet(workbook, sheet, table.columns().size());

            if (includeSummary && summary != null) {
                addSummarySheet(workbook, summary);
            }

            Files.createDirectories(outputDir);
            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
        } catch (IOException e) {
            throw new SpreadsheetExportException("Failed to write spreadsheet " + target.getFileName(), e);
        }

        log.info("[Spreadsheet] Generated {} rows={} columns={} elapsedMs={}",
                target, table.rowCount(), table.columns().size(), System.currentTimeMillis() - startMs);
        return target;
    }

    /**
     * Strips the extension and replaces {@code < > : " / \ | ? *}; an empty result becomes a
     * timestamped export name.
     */
    public static String sanitizeName(String name) {
        String base = name == null ? "" : name.trim();
        int dot = base.lastIndexOf('.');
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (dot > 0 && dot > slash) {
            base = base.substring(0, dot);
        }

        StringBuilder sb = new StringBuilder(base.length());
        for (char c : base.toCharArray()) {
            sb.append(INVALID_CHARS.indexOf(c) >= 0 ? '_' : c);
        }
        String cleaned = sb.toString().trim();
        if (cleaned.isEmpty()) {
            cleaned = "export_" + LocalDateTime.now().format(FALLBACK_NAME);
        }
        return cleaned;
    }

    private void writeData(Sheet sheet, ConsolidatedTable table) {
        List<String> columns = table.columns();
        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c).setCellValue(columns.get(c));
        }

        int r = 1;
        for (Map<String, Object> values : table.rows()) {
            Row row = sheet.createRow(r++);
            for (int c = 0; c < columns.size(); c++) {
                setCellValue(row.createCell(c), columns.get(c), values.get(columns.get(c)));
            }
        }
    }

    private static void setCellValue(Cell cell, String column, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof BigDecimal bd) {
            cell.setCellValue(bd.doubleValue());
        } else if (value instanceof Number n) {
            cell.setCellValue(n.doubleValue());
        } else if (value instanceof LocalDateTime dt) {
            cell.setCellValue(DATE_TIME.format(dt));
        } else if (value instanceof LocalDate d) {
            cell.setCellValue(DATE.format(d));
        } else if (value instanceof TemporalAccessor t) {
            cell.setCellValue(t.toString());
        } else if (value instanceof Boolean b) {
            cell.setCellValue(b);
        } else {
            cell.setCellValue(clipText(value.toString(), column, cell.getRowIndex()));
        }
    }

    static String clipText(String text, String column, int rowIndex) {
        if (text.length() <= MAX_CELL_TEXT) return text;
        log.warn("[Spreadsheet] Clipped column={} row={} from {} to {} characters",
                column, rowIndex, text.length(), MAX_CELL_TEXT);
        return text.substring(0, MAX_CELL_TEXT);
    }

    private void formatDataSheet(XSSFWorkbook workbook, Sheet sheet, int columnCount) {
        try {
            XSSFCellStyle headerStyle = workbook.createCellStyle();
            XSSFFont headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerFont.setFontHeightInPoints((short) 11);
            headerFont.setColor(IndexedColors.WHITE.getIndex());
            headerStyle.setFont(headerFont);
            headerStyle.setFillForegroundColor(new XSSFColor(HEADER_FILL_RGB, null));
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            applyThinBorder(headerStyle);

            CellStyle bodyStyle = workbook.createCellStyle();
            bodyStyle.setAlignment(HorizontalAlignment.LEFT);
            bodyStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            applyThinBorder(bodyStyle);

            int[] maxLength = new int[columnCount];
            for (Row row : sheet) {
                for (Cell cell : row) {
                    int c = cell.getColumnIndex();
                    cell.setCellStyle(row.getRowNum() == 0 ? headerStyle : bodyStyle);
                    if (c < columnCount) {
                        maxLength[c] = Math.max(maxLength[c], displayLength(cell));
                    }
                }
            }

            for (int c = 0; c < columnCount; c++) {
                int width = Math.min(maxLength[c] + 2, MAX_COLUMN_WIDTH);
                sheet.setColumnWidth(c, width * 256);
            }

            sheet.createFreezePane(0, 1);
        } catch (RuntimeException e) {
            log.warn("[Spreadsheet] Error formatting sheet '{}': {}", sheet.getSheetName(), e.toString());
        }
    }

    private void addSummarySheet(Workbook workbook, SummaryStatistics summary) {
        try {
            Sheet sheet = workbook.createSheet(SUMMARY_SHEET);
            workbook.setSheetOrder(SUMMARY_SHEET, 0);
            workbook.setActiveSheet(0);
            workbook.setSelectedTab(0);

            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            CellStyle titleStyle = workbook.createCellStyle();
            titleStyle.setFont(titleFont);

            Font keyFont = workbook.createFont();
            keyFont.setBold(true);
            CellStyle keyStyle = workbook.createCellStyle();
            keyStyle.setFont(keyFont);

            Cell title = sheet.createRow(0).createCell(0);
            title.setCellValue("Extraction Summary");
            title.setCellStyle(titleStyle);

            sheet.createRow(1).createCell(0).setCellValue("Generated: " + LocalDateTime.now().format(DATE_TIME));

            int r = 3;
            for (Map.Entry<String, Object> entry : summary.toEntries().entrySet()) {
                Row row = sheet.createRow(r++);
                Cell key = row.createCell(0);
                key.setCellValue(entry.getKey());
                key.setCellStyle(keyStyle);
                setCellValue(row.createCell(1), entry.getKey(), entry.getValue());
            }

            sheet.setColumnWidth(0, 30 * 256);
            sheet.setColumnWidth(1, 20 * 256);
        } catch (RuntimeException e) {
            log.warn("[Spreadsheet] Error adding summary sheet: {}", e.toString());
        }
    }

    private static void applyThinBorder(CellStyle style) {
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }

    private static int displayLength(Cell cell) {
        return switch (cell.getCellType()) {
            case STRING -> cell.getStringCellValue().length();
            case NUMERIC -> {
                double val = cell.getNumericCellValue();
                yield (val == Math.floor(val) ? String.valueOf((long) val) : String.valueOf(val)).length();
            }
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue()).length();
            default -> 0;
        };
    }
}
