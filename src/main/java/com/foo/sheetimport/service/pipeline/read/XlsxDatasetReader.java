package com.foo.sheetimport.service.pipeline.read;

import com.foo.sheetimport.dataset.CellValue;
import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetColumn;
import com.foo.sheetimport.dataset.DatasetRow;
import com.foo.sheetimport.util.SecureExcelUtils;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

/**
 * Reads one sheet of an {@code .xlsx} workbook into a {@link Dataset}.
 *
 * <p>The first row stored in the sheet holds the headers, even when all of its cells are blank;
 * leading rows Excel never wrote are skipped. Cells keep the type Excel stored them with:
 * date-formatted numbers become timestamps, whole numbers become integers.
 */
@Slf4j
@Service
public class XlsxDatasetReader {

  private static final ThreadLocal<DataFormatter> DATA_FORMATTER =
      ThreadLocal.withInitial(DataFormatter::new);

  // double 로 손실 없이 표현되는 정수 범위
  private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d;

  /**
   * @param sheetName sheet to read; {@code null} or blank reads the first sheet
   */
  public Dataset read(Path xlsxFile, String sheetName) {
    String source = xlsxFile.getFileName().toString();
    try (Workbook workbook = SecureExcelUtils.createWorkbook(xlsxFile)) {
      Sheet sheet = selectSheet(workbook, sheetName, source);
      Dataset dataset = readSheet(sheet, source);
      log.info(
          "Successfully loaded '{}' sheet '{}' with {} rows and {} columns",
          source,
          sheet.getSheetName(),
          dataset.rowCount(),
          dataset.columnCount());
      return dataset;
    } catch (IOException e) {
      throw new DatasetReadException(source, "Error reading Excel file: " + e.getMessage(), e);
    }
  }

  private Sheet selectSheet(Workbook workbook, String sheetName, String source) {
    if (workbook.getNumberOfSheets() == 0) {
      throw new DatasetReadException(source, "Workbook has no sheets");
    }
    if (sheetName == null || sheetName.isBlank()) {
      return workbook.getSheetAt(0);
    }
    Sheet sheet = workbook.getSheet(sheetName);
    if (sheet == null) {
      throw new DatasetReadException(source, "Sheet '" + sheetName + "' not found");
    }
    return sheet;
  }

  private Dataset readSheet(Sheet sheet, String source) {
    int headerRowNum = sheet.getFirstRowNum();
    Row headerRow = headerRowNum < 0 ? null : sheet.getRow(headerRowNum);
    if (headerRow == null) {
      throw new DatasetReadException(source, "Sheet '" + sheet.getSheetName() + "' is empty");
    }

    int width = Math.max(headerRow.getLastCellNum(), 0);
    for (int i = headerRowNum + 1; i <= sheet.getLastRowNum(); i++) {
      Row row = sheet.getRow(i);
      if (row != null) {
        width = Math.max(width, row.getLastCellNum());
      }
    }

    List<DatasetColumn> columns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      Cell cell = headerRow.getCell(c);
      columns.add(DatasetColumn.raw(cell == null ? null : getHeaderText(cell)));
    }
    log.info("Columns: {}", columns.stream().map(DatasetColumn::sourceName).toList());

    List<DatasetRow> rows = new ArrayList<>();
    for (int i = headerRowNum + 1; i <= sheet.getLastRowNum(); i++) {
      Row row = sheet.getRow(i);
      List<CellValue> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(row == null ? CellValue.NULL : toCellValue(row.getCell(c)));
      }
      rows.add(new DatasetRow(i + 1, values));
    }
    return new Dataset(columns, rows);
  }

  private String getHeaderText(Cell cell) {
    return DATA_FORMATTER.get().formatCellValue(cell).trim();
  }

  CellValue toCellValue(Cell cell) {
    if (cell == null) {
      return CellValue.NULL;
    }
    CellType type =
        cell.getCellType() == CellType.FORMULA
            ? cell.getCachedFormulaResultType()
            : cell.getCellType();

    return switch (type) {
      case NUMERIC ->
          DateUtil.isCellDateFormatted(cell)
              ? CellValue.timestamp(cell.getLocalDateTimeCellValue())
              : toNumber(cell.getNumericCellValue());
      case STRING -> CellValue.text(cell.getStringCellValue());
      case BOOLEAN -> CellValue.bool(cell.getBooleanCellValue());
      default -> CellValue.NULL;
    };
  }

  private static CellValue toNumber(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return CellValue.NULL;
    }
    if (value == Math.rint(value) && Math.abs(value) <= MAX_EXACT_INTEGER) {
      return CellValue.integer((long) value);
    }
    return CellValue.decimal(BigDecimal.valueOf(value));
  }
}
