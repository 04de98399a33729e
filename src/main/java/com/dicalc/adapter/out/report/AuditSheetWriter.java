package com.dicalc.adapter.out.report;

import com.dicalc.application.port.out.ReportSection;
import com.dicalc.domain.model.AuditRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;

import java.math.BigDecimal;
import java.util.List;

/**
 * Lays out one report section on a new sheet: title, metadata block, column headers, audit rows.
 * The first sheet of every workbook is a summary with one row per section. Apart from the row
 * appended there, existing sheets of the workbook are never touched.
 */
class AuditSheetWriter {

    static final String SUMMARY_SHEET = "Summary";
    static final List<String> SUMMARY_HEADERS = List.of(
            "No.", "Sheet", "Mode", "Principal", "Period", "Days", "Total interest", "Capped total");

    private static final int MAX_SHEET_NAME = 31;
    private static final int[] SUMMARY_WIDTHS = {6, 24, 12, 16, 26, 7, 16, 16};
    private static final int[] COLUMN_WIDTHS = {6, 12, 12, 7, 16, 12, 12, 22, 18, 16, 48, 48};

    String write(Workbook workbook, ReportSection section) {
        Styles styles = new Styles(workbook);
        Sheet summary = summarySheet(workbook, styles);

        String sheetName = uniqueSheetName(workbook, section.getPreferredSheetName());
        Sheet sheet = workbook.createSheet(sheetName);

        int rowIndex = 0;
        Row titleRow = sheet.createRow(rowIndex++);
        text(titleRow, 0, section.getTitle(), styles.bold);

        for (ReportSection.MetadataField field : section.getFields()) {
            Row row = sheet.createRow(rowIndex++);
            text(row, 0, field.label(), styles.bold);
            text(row, 1, field.value(), null);
        }
        rowIndex++;

        Row header = sheet.createRow(rowIndex++);
        for (int i = 0; i < AuditRow.HEADERS.size(); i++) {
            text(header, i, AuditRow.HEADERS.get(i), styles.bold);
        }

        for (AuditRow auditRow : section.getRows()) {
            writeAuditRow(sheet.createRow(rowIndex++), auditRow, styles);
        }

        for (int i = 0; i < COLUMN_WIDTHS.length; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTHS[i] * 256);
        }

        if (section.getSummary() != null) {
            writeSummaryRow(summary, sheetName, section.getSummary(), styles);
        }
        return sheetName;
    }

    private Sheet summarySheet(Workbook workbook, Styles styles) {
        Sheet existing = workbook.getSheet(SUMMARY_SHEET);
        if (existing != null) {
            return existing;
        }
        Sheet summary = workbook.createSheet(SUMMARY_SHEET);
        workbook.setSheetOrder(SUMMARY_SHEET, 0);
        workbook.setActiveSheet(0);

        text(summary.createRow(0), 0, "Interest calculation summary", styles.bold);
        Row header = summary.createRow(2);
        for (int i = 0; i < SUMMARY_HEADERS.size(); i++) {
            text(header, i, SUMMARY_HEADERS.get(i), styles.bold);
        }
        for (int i = 0; i < SUMMARY_WIDTHS.length; i++) {
            summary.setColumnWidth(i, SUMMARY_WIDTHS[i] * 256);
        }
        return summary;
    }

    private void writeSummaryRow(Sheet summary, String sheetName, ReportSection.SummaryLine line, Styles styles) {
        // title, blank, header
        int sequence = summary.getLastRowNum() - 1;
        Row row = summary.createRow(summary.getLastRowNum() + 1);
        row.createCell(0).setCellValue(sequence);
        text(row, 1, sheetName, null);
        text(row, 2, line.mode(), null);
        number(row, 3, line.principal(), styles.money);
        text(row, 4, line.startDate() + " to " + line.endDate(), null);
        row.createCell(5).setCellValue(line.days());
        number(row, 6, line.totalInterest(), styles.money);
        number(row, 7, line.cappedTotal(), styles.money);
    }

    private void writeAuditRow(Row row, AuditRow auditRow, Styles styles) {
        CellStyle label = auditRow.isTotal() ? styles.bold : null;
        CellStyle money = auditRow.isTotal() ? styles.boldMoney : styles.money;
        List<String> cells = auditRow.cells();

        if (auditRow.getSequence() == null) {
            text(row, 0, cells.get(0), label);
        } else {
            row.createCell(0).setCellValue(auditRow.getSequence());
        }
        text(row, 1, cells.get(1), label);
        text(row, 2, cells.get(2), label);
        row.createCell(3).setCellValue(auditRow.getDays());
        number(row, 4, auditRow.getPrincipalBase(), money);
        number(row, 5, auditRow.getBenchmarkRate(), styles.rate);
        number(row, 6, auditRow.getApplicableRate(), styles.rate);
        // text keeps every digit of the daily fraction
        text(row, 7, cells.get(7), null);
        number(row, 8, auditRow.getInterest(), money);
        number(row, 9, auditRow.getCapLimit(), money);
        text(row, 10, cells.get(10), null);
        text(row, 11, cells.get(11), null);
    }

    private static void text(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value == null ? "" : value);
        if (style != null) {
            cell.setCellStyle(style);
        }
    }

    private static void number(Row row, int column, BigDecimal value, CellStyle style) {
        Cell cell = row.createCell(column);
        if (value == null) {
            cell.setCellValue("-");
            return;
        }
        cell.setCellValue(value.doubleValue());
        cell.setCellStyle(style);
    }

    static String uniqueSheetName(Workbook workbook, String preferred) {
        String base = WorkbookUtil.createSafeSheetName(preferred == null || preferred.isBlank() ? "Calculation" : preferred);
        String candidate = base;
        int suffix = 2;
        while (workbook.getSheet(candidate) != null) {
            String tail = " (" + suffix++ + ")";
            candidate = base.substring(0, Math.min(base.length(), MAX_SHEET_NAME - tail.length())) + tail;
        }
        return candidate;
    }

    private static final class Styles {
        private final CellStyle bold;
        private final CellStyle money;
        private final CellStyle boldMoney;
        private final CellStyle rate;

        private Styles(Workbook workbook) {
            Font boldFont = workbook.createFont();
            boldFont.setBold(true);
            short moneyFormat = workbook.createDataFormat().getFormat("#,##0.00");
            short rateFormat = workbook.createDataFormat().getFormat("0.00####");

            bold = workbook.createCellStyle();
            bold.setFont(boldFont);

            money = workbook.createCellStyle();
            money.setDataFormat(moneyFormat);

            boldMoney = workbook.createCellStyle();
            boldMoney.setDataFormat(moneyFormat);
            boldMoney.setFont(boldFont);

            rate = workbook.createCellStyle();
            rate.setDataFormat(rateFormat);
        }
    }
}
