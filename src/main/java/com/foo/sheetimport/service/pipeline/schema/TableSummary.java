package com.foo.sheetimport.service.pipeline.schema;

import java.util.List;

/** What the populated table looks like, read back from the database. */
public record TableSummary(String tableName, long rowCount, List<TableColumnInfo> columns) {

  public int columnCount() {
    return columns.size();
  }
}
