package com.foo.sheetimport.service.pipeline.clean;

import com.foo.sheetimport.dataset.Dataset;

public record NormalizationResult(
    Dataset dataset, int rowsRead, int emptyRowsRemoved, int duplicateRowsRemoved) {}
