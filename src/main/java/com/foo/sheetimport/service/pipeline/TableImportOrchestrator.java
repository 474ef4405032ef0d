package com.foo.sheetimport.service.pipeline;

import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.service.pipeline.clean.NormalizationResult;
import com.foo.sheetimport.service.pipeline.clean.TypeInferrer;
import com.foo.sheetimport.service.pipeline.clean.ValueNormalizer;
import com.foo.sheetimport.service.pipeline.load.BatchLoader;
import com.foo.sheetimport.service.pipeline.load.DroppedRange;
import com.foo.sheetimport.service.pipeline.load.ImportOutcome;
import com.foo.sheetimport.service.pipeline.load.JdbcBatchWriter;
import com.foo.sheetimport.service.pipeline.read.XlsxDatasetReader;
import com.foo.sheetimport.service.pipeline.sanitize.ColumnNameSanitizer;
import com.foo.sheetimport.service.pipeline.schema.SchemaCreationException;
import com.foo.sheetimport.service.pipeline.schema.SchemaGenerator;
import com.foo.sheetimport.service.pipeline.schema.TableColumnInfo;
import com.foo.sheetimport.service.pipeline.schema.TableInspector;
import com.foo.sheetimport.service.pipeline.schema.TableSummary;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Service;

/**
 * Runs a whole import: column cleanup, type inference, table replacement, batched load and a
 * summary read back from the table.
 *
 * <p>Reading the source, creating the table and obtaining a connection are fatal and propagate.
 * Rows the database rejects are reported in the summary instead. All statements of one import run
 * on a single connection in auto-commit mode, so every batch commits on its own and nothing is
 * rolled back if the caller gives up halfway. Imports into the same table must not overlap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableImportOrchestrator {

  private final XlsxDatasetReader datasetReader;
  private final ColumnNameSanitizer columnNameSanitizer;
  private final ValueNormalizer valueNormalizer;
  private final TypeInferrer typeInferrer;
  private final SchemaGenerator schemaGenerator;
  private final BatchLoader batchLoader;
  private final TableInspector tableInspector;
  private final JdbcTemplate jdbcTemplate;

  @Builder
  public record ImportSummary(
      String tableName,
      int rowsRead,
      int emptyRowsRemoved,
      int duplicateRowsRemoved,
      int rowsAttempted,
      int rowsPersisted,
      int rowsDropped,
      List<DroppedRange> droppedRanges,
      long tableRowCount,
      int columnCount,
      List<TableColumnInfo> columns) {

    public boolean partial() {
      return rowsPersisted < rowsAttempted;
    }
  }

  public ImportSummary importWorkbook(Path xlsxFile, String tableName, String sheetName) {
    SchemaGenerator.requireValidTableName(tableName);
    log.info("Step 1: Reading Excel file '{}'", xlsxFile.getFileName());
    Dataset raw = datasetReader.read(xlsxFile, sheetName);
    return importDataset(raw, tableName);
  }

  public ImportSummary importDataset(Dataset raw, String tableName) {
    SchemaGenerator.requireValidTableName(tableName);

    // 2. 컬럼명 정리
    log.info("Step 2: Cleaning column names");
    Dataset named = columnNameSanitizer.sanitize(raw);

    // 3. 값 정리 및 컬럼 타입 추론
    log.info("Step 3: Cleaning data");
    NormalizationResult normalized = valueNormalizer.normalize(named);
    Dataset typed = typeInferrer.infer(normalized.dataset());

    // 4. DDL 생성
    List<String> ddl = schemaGenerator.generate(tableName, typed);

    return jdbcTemplate.execute(
        (Connection connection) -> {
          boolean autoCommit = connection.getAutoCommit();
          connection.setAutoCommit(true);
          try {
            JdbcTemplate session =
                new JdbcTemplate(new SingleConnectionDataSource(connection, true));

            log.info("Step 4: Creating table '{}'", tableName);
            createTable(session, tableName, ddl);

            // 5. 배치 적재
            log.info("Step 5: Importing data to table '{}'", tableName);
            ImportOutcome outcome =
                batchLoader.load(
                    typed.rows(), new JdbcBatchWriter(session, tableName, typed.columns()));

            // 6. 적재 결과는 메모리 집계가 아닌 실제 테이블에서 조회
            TableSummary table = tableInspector.summarize(session, tableName);
            return toSummary(normalized, outcome, table);
          } finally {
            connection.setAutoCommit(autoCommit);
          }
        });
  }

  private void createTable(JdbcOperations session, String tableName, List<String> ddl) {
    try {
      ddl.forEach(session::execute);
    } catch (DataAccessException e) {
      log.error("Failed to create table '{}'", tableName, e);
      throw new SchemaCreationException(tableName, e);
    }
    log.info("Table '{}' created successfully", tableName);
  }

  private ImportSummary toSummary(
      NormalizationResult normalized, ImportOutcome outcome, TableSummary table) {
    return ImportSummary.builder()
        .tableName(table.tableName())
        .rowsRead(normalized.rowsRead())
        .emptyRowsRemoved(normalized.emptyRowsRemoved())
        .duplicateRowsRemoved(normalized.duplicateRowsRemoved())
        .rowsAttempted(outcome.rowsAttempted())
        .rowsPersisted(outcome.rowsPersisted())
        .rowsDropped(outcome.rowsDropped())
        .droppedRanges(outcome.droppedRanges())
        .tableRowCount(table.rowCount())
        .columnCount(table.columnCount())
        .columns(table.columns())
        .build();
  }
}
