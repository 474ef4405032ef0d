package com.foo.sheetimport.service.pipeline.schema;

import static com.foo.sheetimport.service.pipeline.sanitize.ColumnNameSanitizer.PRIMARY_KEY_COLUMN;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Reads shape and contents of an imported table back from the database. */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableInspector {

  private static final String COLUMNS_SQL =
      "SELECT column_name, data_type FROM information_schema.columns"
          + " WHERE table_schema = current_schema AND table_name = ?"
          + " ORDER BY ordinal_position";

  private final JdbcTemplate jdbcTemplate;

  public TableSummary summarize(String tableName) {
    return summarize(jdbcTemplate, tableName);
  }

  public TableSummary summarize(JdbcOperations jdbc, String tableName) {
    SchemaGenerator.requireValidTableName(tableName);
    Long rowCount = jdbc.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
    List<TableColumnInfo> columns =
        jdbc.query(
            COLUMNS_SQL,
            (rs, rowNum) -> new TableColumnInfo(rs.getString(1), rs.getString(2)),
            tableName);

    TableSummary summary = new TableSummary(tableName, rowCount == null ? 0 : rowCount, columns);
    log.info("Import summary for '{}': {} rows, {} columns", tableName, summary.rowCount(),
        summary.columnCount());
    columns.forEach(column -> log.info("  - {}", column));
    return summary;
  }

  /** First {@code limit} rows of the table in insertion order. */
  public List<Map<String, Object>> preview(String tableName, int limit) {
    SchemaGenerator.requireValidTableName(tableName);
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    return jdbcTemplate.queryForList(
        "SELECT * FROM " + tableName + " ORDER BY " + PRIMARY_KEY_COLUMN + " LIMIT ?", limit);
  }
}
