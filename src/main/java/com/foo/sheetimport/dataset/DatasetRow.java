package com.foo.sheetimport.dataset;

import java.util.List;

/**
 * One data row, positionally aligned with {@link Dataset#columns()}.
 *
 * @param sourceRowNumber 1-based row number in the source sheet
 */
public record DatasetRow(int sourceRowNumber, List<CellValue> values) {

  public DatasetRow {
    values = List.copyOf(values);
  }

  public CellValue get(int columnIndex) {
    return values.get(columnIndex);
  }

  public int size() {
    return values.size();
  }

  public boolean isBlank() {
    return values.stream().allMatch(CellValue::isBlank);
  }
}
