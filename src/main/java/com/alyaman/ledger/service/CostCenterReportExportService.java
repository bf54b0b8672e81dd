package com.alyaman.ledger.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.alyaman.ledger.service.CostCenterService.CashFlow;
import com.alyaman.ledger.service.CostCenterService.CostCenterReport;
import com.alyaman.ledger.service.CostCenterService.ProfitAndLoss;

/**
 * Writes the cost center report to an Excel workbook with an analysis sheet and a cash flow sheet.
 */
@Service
public class CostCenterReportExportService {

  private static final Logger log = LoggerFactory.getLogger(CostCenterReportExportService.class);

  static final String ANALYSIS_SHEET = "Cost Center Analysis";
  static final String CASH_FLOW_SHEET = "Cost Center Cash Flow";

  private static final String AMOUNT_FORMAT = "#,##0.00";

  private final DateTimeFormatter dateFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd");

  public byte[] exportToExcel(CostCenterReport report) {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

      CellStyle headerStyle = createHeaderStyle(workbook);
      CellStyle amountStyle = createAmountStyle(workbook);
      CellStyle totalStyle = createTotalStyle(workbook);

      writeAnalysisSheet(workbook, report, headerStyle, amountStyle, totalStyle);
      writeCashFlowSheet(workbook, report, headerStyle, amountStyle);

      workbook.write(baos);
      log.info("Generated cost center Excel ({} bytes)", baos.size());
      return baos.toByteArray();

    } catch (IOException e) {
      log.error("Failed to generate cost center Excel", e);
      throw new RuntimeException("Failed to generate cost center Excel: " + e.getMessage(), e);
    }
  }

  private void writeAnalysisSheet(
      Workbook workbook,
      CostCenterReport report,
      CellStyle headerStyle,
      CellStyle amountStyle,
      CellStyle totalStyle) {
    Sheet sheet = workbook.createSheet(ANALYSIS_SHEET);
    int rowNum = 0;

    sheet.createRow(rowNum++).createCell(0).setCellValue("Cost Center Analysis");
    sheet.createRow(rowNum++).createCell(0).setCellValue(periodLabel(report));
    rowNum++;

    String[] headers = {
      "Code", "Name", "Revenue", "Expenses", "Teacher Salaries", "Other Expenses", "Profit/Loss",
      "Budget Variance", "Courses"
    };
    writeHeader(sheet.createRow(rowNum++), headers, headerStyle);

    for (ProfitAndLoss line : report.profitAndLoss()) {
      Row row = sheet.createRow(rowNum++);
      row.createCell(0).setCellValue(line.costCenter().getCode());
      row.createCell(1).setCellValue(line.costCenter().getDisplayName());
      writeAmount(row, 2, line.totalRevenue(), amountStyle);
      writeAmount(row, 3, line.totalExpenses(), amountStyle);
      writeAmount(row, 4, line.teacherSalaries(), amountStyle);
      writeAmount(row, 5, line.otherExpenses(), amountStyle);
      writeAmount(row, 6, line.profit(), amountStyle);
      writeAmount(row, 7, line.budgetVariance(), amountStyle);
      row.createCell(8).setCellValue(line.courseCount());
    }

    Row totalsRow = sheet.createRow(rowNum);
    Cell totalLabel = totalsRow.createCell(1);
    totalLabel.setCellValue("Totals");
    totalLabel.setCellStyle(totalStyle);
    writeAmount(totalsRow, 2, report.totalRevenue(), totalStyle);
    writeAmount(totalsRow, 3, report.totalExpenses(), totalStyle);
    writeAmount(totalsRow, 6, report.totalProfit(), totalStyle);

    setColumnWidths(sheet, headers.length);
  }

  private void writeCashFlowSheet(
      Workbook workbook, CostCenterReport report, CellStyle headerStyle, CellStyle amountStyle) {
    Sheet sheet = workbook.createSheet(CASH_FLOW_SHEET);
    int rowNum = 0;

    sheet.createRow(rowNum++).createCell(0).setCellValue("Cost Center Cash Flow");
    sheet.createRow(rowNum++).createCell(0).setCellValue(periodLabel(report));
    rowNum++;

    String[] headers = {
      "Code", "Name", "Opening Balance", "Cash Inflow", "Cash Outflow", "Net Cash Flow",
      "Closing Balance"
    };
    writeHeader(sheet.createRow(rowNum++), headers, headerStyle);

    for (CashFlow line : report.cashFlows()) {
      Row row = sheet.createRow(rowNum++);
      row.createCell(0).setCellValue(line.costCenter().getCode());
      row.createCell(1).setCellValue(line.costCenter().getDisplayName());
      writeAmount(row, 2, line.openingBalance(), amountStyle);
      writeAmount(row, 3, line.cashInflow(), amountStyle);
      writeAmount(row, 4, line.cashOutflow(), amountStyle);
      writeAmount(row, 5, line.netCashFlow(), amountStyle);
      writeAmount(row, 6, line.closingBalance(), amountStyle);
    }

    setColumnWidths(sheet, headers.length);
  }

  private String periodLabel(CostCenterReport report) {
    String start = report.startDate() != null ? report.startDate().format(dateFormatter) : "beginning";
    String end = report.endDate() != null ? report.endDate().format(dateFormatter) : "today";
    return "Period: " + start + " to " + end;
  }

  private void writeHeader(Row row, String[] headers, CellStyle headerStyle) {
    for (int i = 0; i < headers.length; i++) {
      Cell cell = row.createCell(i);
      cell.setCellValue(headers[i]);
      cell.setCellStyle(headerStyle);
    }
  }

  private void writeAmount(Row row, int column, BigDecimal amount, CellStyle style) {
    Cell cell = row.createCell(column);
    cell.setCellValue(amount != null ? amount.doubleValue() : 0d);
    cell.setCellStyle(style);
  }

  // Fixed widths; autoSizeColumn needs fonts that headless hosts may lack
  private void setColumnWidths(Sheet sheet, int columns) {
    sheet.setColumnWidth(0, 12 * 256);
    sheet.setColumnWidth(1, 32 * 256);
    for (int i = 2; i < columns; i++) {
      sheet.setColumnWidth(i, 18 * 256);
    }
  }

  private CellStyle createHeaderStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
    style.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    font.setColor(IndexedColors.WHITE.getIndex());
    style.setFont(font);

    style.setBorderBottom(BorderStyle.THIN);
    style.setBorderTop(BorderStyle.THIN);
    return style;
  }

  private CellStyle createAmountStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    DataFormat format = workbook.createDataFormat();
    style.setDataFormat(format.getFormat(AMOUNT_FORMAT));
    return style;
  }

  private CellStyle createTotalStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    org.apache.poi.ss.usermodel.Font font = workbook.createFont();
    font.setBold(true);
    style.setFont(font);
    style.setBorderTop(BorderStyle.DOUBLE);
    DataFormat format = workbook.createDataFormat();
    style.setDataFormat(format.getFormat(AMOUNT_FORMAT));
    return style;
  }
}
