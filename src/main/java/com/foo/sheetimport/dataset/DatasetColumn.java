package com.foo.sheetimport.dataset;

/**
 * A column as read from the source and as it will be stored.
 *
 * @param sourceName header text as it appeared in the spreadsheet, may be {@code null}
 * @param name resolved storage identifier, {@code null} until sanitized
 * @param type semantic type, {@code TEXT} until inferred
 */
public record DatasetColumn(String sourceName, String name, ColumnType type) {

  public static DatasetColumn raw(String sourceName) {
    return new DatasetColumn(sourceName, null, ColumnType.TEXT);
  }

  public DatasetColumn withName(String resolvedName) {
    return new DatasetColumn(sourceName, resolvedName, type);
  }

  public DatasetColumn withType(ColumnType inferredType) {
    return new DatasetColumn(sourceName, name, inferredType);
  }
}
