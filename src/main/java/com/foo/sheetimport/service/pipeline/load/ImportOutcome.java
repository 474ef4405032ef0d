package com.foo.sheetimport.service.pipeline.load;

import java.util.List;

/** Final tally of one load. A partial outcome is still a successful load. */
public record ImportOutcome(
    int rowsAttempted,
    int rowsPersisted,
    List<DroppedRange> droppedRanges,
    List<BatchReport> batches) {

  public ImportOutcome {
    droppedRanges = List.copyOf(droppedRanges);
    batches = List.copyOf(batches);
  }

  public int rowsDropped() {
    return rowsAttempted - rowsPersisted;
  }

  public boolean isPartial() {
    return rowsPersisted < rowsAttempted;
  }
}
