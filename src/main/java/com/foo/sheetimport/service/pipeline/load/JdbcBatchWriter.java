package com.foo.sheetimport.service.pipeline.load;

import com.foo.sheetimport.dataset.CellValue;
import com.foo.sheetimport.dataset.ColumnType;
import com.foo.sheetimport.dataset.DatasetColumn;
import com.foo.sheetimport.dataset.DatasetRow;
import com.foo.sheetimport.dataset.ValueKind;
import com.foo.sheetimport.service.contract.BatchWriter;
import com.foo.sheetimport.service.pipeline.schema.SchemaGenerator;
import java.math.RoundingMode;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcOperations;

/** Inserts each group of rows with one multi-row {@code INSERT ... VALUES (...), (...)}. */
public class JdbcBatchWriter implements BatchWriter {

  static final int DECIMAL_SCALE = 4;

  // SQLSTATE 22000: data exception
  private static final String DATA_EXCEPTION = "22000";

  private final JdbcOperations jdbc;
  private final List<DatasetColumn> columns;
  private final String insertPrefix;
  private final String rowPlaceholders;

  public JdbcBatchWriter(JdbcOperations jdbc, String tableName, List<DatasetColumn> columns) {
    SchemaGenerator.requireValidTableName(tableName);
    this.jdbc = jdbc;
    this.columns = List.copyOf(columns);
    this.insertPrefix =
        "INSERT INTO "
            + tableName
            + " ("
            + columns.stream()
                .map(column -> SchemaGenerator.quote(column.name()))
                .collect(Collectors.joining(", "))
            + ") VALUES ";
    this.rowPlaceholders = "(" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
  }

  @Override
  public void write(List<DatasetRow> rows) {
    if (rows.isEmpty()) {
      return;
    }
    jdbc.update(
        insertSql(rows.size()),
        ps -> {
          int index = 1;
          for (DatasetRow row : rows) {
            for (int c = 0; c < columns.size(); c++) {
              bind(ps, index++, columns.get(c).type(), row.get(c));
            }
          }
        });
  }

  String insertSql(int rowCount) {
    return insertPrefix + String.join(", ", Collections.nCopies(rowCount, rowPlaceholders));
  }

  static void bind(PreparedStatement ps, int index, ColumnType type, CellValue value)
      throws SQLException {
    if (value.isNull()) {
      ps.setNull(index, jdbcType(type));
      return;
    }
    try {
      switch (type) {
        case TEXT -> ps.setString(index, value.asText());
        case INTEGER -> ps.setLong(index, value.asLong());
        case DECIMAL ->
            ps.setBigDecimal(
                index, value.asDecimal().setScale(DECIMAL_SCALE, RoundingMode.HALF_UP));
        case BOOLEAN -> ps.setBoolean(index, value.asBoolean());
        case TIMESTAMP -> ps.setTimestamp(index, Timestamp.valueOf(value.asTimestamp()));
      }
    } catch (ArithmeticException | IllegalStateException | IllegalArgumentException e) {
      // JdbcTemplate 이 DataAccessException 으로 번역한다
      throw new SQLException(
          "Cannot bind %s value '%s' at parameter %d: %s"
              .formatted(type, abbreviate(value), index, e.getMessage()),
          DATA_EXCEPTION,
          e);
    }
  }

  private static String abbreviate(CellValue value) {
    String text = value.kind() == ValueKind.DECIMAL ? value.value().toString() : value.asText();
    return text.length() <= 40 ? text : text.substring(0, 40) + "...";
  }

  private static int jdbcType(ColumnType type) {
    return switch (type) {
      case TEXT -> Types.VARCHAR;
      case INTEGER -> Types.BIGINT;
      case DECIMAL -> Types.DECIMAL;
      case BOOLEAN -> Types.BOOLEAN;
      case TIMESTAMP -> Types.TIMESTAMP;
    };
  }
}
