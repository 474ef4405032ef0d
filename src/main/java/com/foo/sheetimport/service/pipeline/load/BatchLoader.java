package com.foo.sheetimport.service.pipeline.load;

import com.foo.sheetimport.dataset.DatasetRow;
import com.foo.sheetimport.service.contract.BatchWriter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Loads rows in batches of {@value #BATCH_SIZE}. A batch the database rejects is split into
 * sub-batches of {@value #SUB_BATCH_SIZE} that are tried once each; a failing sub-batch is dropped
 * and loading moves on. Rejected writes never abort the load.
 */
@Slf4j
@Component
public class BatchLoader {

  public static final int BATCH_SIZE = 100;
  public static final int SUB_BATCH_SIZE = 25;

  public ImportOutcome load(List<DatasetRow> rows, BatchWriter writer) {
    int totalRows = rows.size();
    int totalBatches = (totalRows + BATCH_SIZE - 1) / BATCH_SIZE;
    log.info("Starting import of {} rows, batch size {}", totalRows, BATCH_SIZE);

    int persisted = 0;
    List<DroppedRange> dropped = new ArrayList<>();
    List<BatchReport> reports = new ArrayList<>(totalBatches);

    for (int start = 0, batchNumber = 1; start < totalRows; start += BATCH_SIZE, batchNumber++) {
      int end = Math.min(start + BATCH_SIZE, totalRows);
      log.info("Importing batch {}/{} (rows {}-{})", batchNumber, totalBatches, start + 1, end);

      BatchReport report = loadBatch(rows, start, end, batchNumber, writer, dropped);
      reports.add(report);
      persisted += report.rowsPersisted();
      log.info("Batch {} done. Progress: {}/{} rows", batchNumber, persisted, totalRows);
    }

    ImportOutcome outcome = new ImportOutcome(totalRows, persisted, dropped, reports);
    if (outcome.isPartial()) {
      log.warn(
          "Import finished with {} of {} rows; {} rows were skipped due to errors",
          persisted,
          totalRows,
          outcome.rowsDropped());
    } else {
      log.info("Import finished: {}/{} rows", persisted, totalRows);
    }
    return outcome;
  }

  private BatchReport loadBatch(
      List<DatasetRow> rows,
      int start,
      int end,
      int batchNumber,
      BatchWriter writer,
      List<DroppedRange> dropped) {
    List<DatasetRow> batch = rows.subList(start, end);
    BatchState state = BatchState.PENDING.start();
    WriteAttempt attempt = attempt(writer, batch);
    state = state.onAttempt(attempt);

    if (state == BatchState.PERSISTED) {
      return new BatchReport(batchNumber, batch.size(), batch.size(), false);
    }

    log.warn("Error in batch {}: {}", batchNumber, attempt.failure());
    log.info("Retrying batch {} with sub-batches of {}", batchNumber, SUB_BATCH_SIZE);
    int batchPersisted = 0;
    for (int subStart = start; subStart < end; subStart += SUB_BATCH_SIZE) {
      int subEnd = Math.min(subStart + SUB_BATCH_SIZE, end);
      List<DatasetRow> subBatch = rows.subList(subStart, subEnd);
      WriteAttempt subAttempt = attempt(writer, subBatch);
      BatchState subState = state.onAttempt(subAttempt);

      if (subState == BatchState.PERSISTED) {
        batchPersisted += subBatch.size();
        log.info("  Sub-batch rows {}-{} imported", subStart + 1, subEnd);
      } else {
        log.warn(
            "  Skipping rows {}-{} (sheet rows {}-{}): {}",
            subStart + 1,
            subEnd,
            subBatch.get(0).sourceRowNumber(),
            subBatch.get(subBatch.size() - 1).sourceRowNumber(),
            subAttempt.failure());
        dropped.add(
            new DroppedRange(
                subStart,
                subEnd,
                subBatch.get(0).sourceRowNumber(),
                subBatch.get(subBatch.size() - 1).sourceRowNumber(),
                subAttempt.failure()));
      }
    }
    log.info(
        "Batch {} recovery complete. Imported {}/{} rows from this batch",
        batchNumber,
        batchPersisted,
        batch.size());
    return new BatchReport(batchNumber, batch.size(), batchPersisted, true);
  }

  private WriteAttempt attempt(BatchWriter writer, List<DatasetRow> rows) {
    try {
      writer.write(rows);
      return WriteAttempt.succeeded(rows.size());
    } catch (DataAccessException e) {
      return WriteAttempt.failed(rows.size(), e);
    }
  }
}
