package com.foo.sheetimport.service.pipeline.clean;

import com.foo.sheetimport.dataset.CellValue;
import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetRow;
import com.foo.sheetimport.dataset.ValueKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Row-level cleanup that runs before type inference: empty rows and exact duplicates are
 * removed, then text cells are trimmed and placeholder text is turned into nulls.
 */
@Slf4j
@Component
public class ValueNormalizer {

  private static final String NAN_TEXT = "nan";

  public NormalizationResult normalize(Dataset dataset) {
    int rowsRead = dataset.rowCount();
    log.info("Original data shape: {} rows x {} columns", rowsRead, dataset.columnCount());

    List<DatasetRow> nonEmpty = dataset.rows().stream().filter(row -> !row.isBlank()).toList();
    int emptyRemoved = rowsRead - nonEmpty.size();
    log.info("After removing empty rows: {} rows", nonEmpty.size());

    // 첫 번째로 나온 행을 남기고 값이 완전히 같은 행은 제거
    Set<List<CellValue>> seen = new HashSet<>();
    List<DatasetRow> distinct = new ArrayList<>(nonEmpty.size());
    for (DatasetRow row : nonEmpty) {
      if (seen.add(row.values())) {
        distinct.add(row);
      }
    }
    int duplicatesRemoved = nonEmpty.size() - distinct.size();
    if (duplicatesRemoved > 0) {
      log.info("Removed {} duplicate rows", duplicatesRemoved);
    }

    List<DatasetRow> cleaned = distinct.stream().map(ValueNormalizer::cleanText).toList();
    return new NormalizationResult(
        dataset.withRows(cleaned), rowsRead, emptyRemoved, duplicatesRemoved);
  }

  private static DatasetRow cleanText(DatasetRow row) {
    List<CellValue> values = new ArrayList<>(row.size());
    for (CellValue value : row.values()) {
      values.add(cleanText(value));
    }
    return new DatasetRow(row.sourceRowNumber(), values);
  }

  static CellValue cleanText(CellValue value) {
    if (value.kind() != ValueKind.TEXT) {
      return value;
    }
    String trimmed = value.asText().strip();
    if (trimmed.isEmpty() || NAN_TEXT.equals(trimmed)) {
      return CellValue.NULL;
    }
    return CellValue.text(trimmed);
  }
}
