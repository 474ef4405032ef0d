package com.foo.sheetimport.dataset;

/** Semantic type assigned to a whole column by type inference. */
public enum ColumnType {
  TEXT,
  INTEGER,
  DECIMAL,
  TIMESTAMP,
  BOOLEAN
}
