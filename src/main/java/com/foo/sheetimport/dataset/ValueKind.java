package com.foo.sheetimport.dataset;

/** Tag of a {@link CellValue}. */
public enum ValueKind {
  NULL,
  TEXT,
  INTEGER,
  DECIMAL,
  BOOLEAN,
  TIMESTAMP
}
