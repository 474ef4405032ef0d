package com.foo.sheetimport.service.pipeline.load;

public record BatchReport(
    int batchNumber, int rowsAttempted, int rowsPersisted, boolean retriedInSubBatches) {}
