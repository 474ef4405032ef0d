package com.foo.sheetimport.service.pipeline.load;

/**
 * Rows that could not be written even after the sub-batch retry.
 *
 * @param fromIndex first dropped row, 0-based position in the loaded rows
 * @param toIndex one past the last dropped row
 * @param firstSourceRow sheet row number of the first dropped row
 * @param lastSourceRow sheet row number of the last dropped row
 * @param cause database message of the failed insert
 */
public record DroppedRange(
    int fromIndex, int toIndex, int firstSourceRow, int lastSourceRow, String cause) {

  public int size() {
    return toIndex - fromIndex;
  }
}
