package com.foo.sheetimport.dataset;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory table handed to the import pipeline.
 *
 * <p>Column order is the order of the generated table. Every row has exactly one value per
 * column. Instances are immutable; pipeline steps return new datasets.
 */
public final class Dataset {

  private final List<DatasetColumn> columns;
  private final List<DatasetRow> rows;

  public Dataset(List<DatasetColumn> columns, List<DatasetRow> rows) {
    this.columns = List.copyOf(columns);
    this.rows = List.copyOf(rows);
    for (DatasetRow row : this.rows) {
      if (row.size() != this.columns.size()) {
        throw new IllegalArgumentException(
            "Row %d has %d values but dataset has %d columns"
                .formatted(row.sourceRowNumber(), row.size(), this.columns.size()));
      }
    }
  }

  /**
   * Builds a dataset from raw headers and positional rows. Rows are numbered as if the header
   * sat on sheet row 1.
   */
  public static Dataset of(List<String> headers, List<List<CellValue>> rowValues) {
    List<DatasetColumn> columns = headers.stream().map(DatasetColumn::raw).toList();
    List<DatasetRow> rows = new ArrayList<>(rowValues.size());
    for (int i = 0; i < rowValues.size(); i++) {
      rows.add(new DatasetRow(i + 2, rowValues.get(i)));
    }
    return new Dataset(columns, rows);
  }

  public List<DatasetColumn> columns() {
    return columns;
  }

  public List<DatasetRow> rows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public List<String> columnNames() {
    return columns.stream().map(DatasetColumn::name).toList();
  }

  public Dataset withColumns(List<DatasetColumn> newColumns) {
    return new Dataset(newColumns, rows);
  }

  public Dataset withRows(List<DatasetRow> newRows) {
    return new Dataset(columns, newRows);
  }
}
