package com.foo.sheetimport.service.pipeline.schema;

import static com.foo.sheetimport.service.pipeline.sanitize.ColumnNameSanitizer.CREATED_AT_COLUMN;
import static com.foo.sheetimport.service.pipeline.sanitize.ColumnNameSanitizer.PRIMARY_KEY_COLUMN;
import static com.foo.sheetimport.service.pipeline.sanitize.ColumnNameSanitizer.UPDATED_AT_COLUMN;

import com.foo.sheetimport.dataset.ColumnType;
import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetColumn;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Produces the statements that replace the target table with one shaped after a typed dataset.
 *
 * <p>The generated table starts with a surrogate {@code id} key, continues with the dataset
 * columns in order and ends with {@code created_at} / {@code updated_at} audit columns. Any
 * existing table of the same name is dropped together with its dependents, so running two imports
 * against one table at the same time is unsafe.
 */
@Component
public class SchemaGenerator {

  private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

  public List<String> generate(String tableName, Dataset dataset) {
    requireValidTableName(tableName);
    if (dataset.columns().isEmpty()) {
      throw new IllegalArgumentException("Dataset has no columns to create a table from");
    }

    String columnDefinitions =
        dataset.columns().stream()
            .map(SchemaGenerator::columnDefinition)
            .collect(Collectors.joining(",\n    "));

    String createTable =
        "CREATE TABLE "
            + tableName
            + " (\n    "
            + PRIMARY_KEY_COLUMN
            + " SERIAL PRIMARY KEY,\n    "
            + columnDefinitions
            + ",\n    "
            + CREATED_AT_COLUMN
            + " TIMESTAMP DEFAULT CURRENT_TIMESTAMP,\n    "
            + UPDATED_AT_COLUMN
            + " TIMESTAMP DEFAULT CURRENT_TIMESTAMP\n)";

    return List.of(dropTableStatement(tableName), createTable);
  }

  public static String sqlType(ColumnType type) {
    return switch (type) {
      case TEXT -> "TEXT";
      // 64비트 정수: 큰 식별자 값의 오버플로 방지
      case INTEGER -> "BIGINT";
      case DECIMAL -> "DECIMAL(15,4)";
      case TIMESTAMP -> "TIMESTAMP";
      case BOOLEAN -> "BOOLEAN";
    };
  }

  public static String quote(String identifier) {
    return "\"" + identifier + "\"";
  }

  public static void requireValidTableName(String tableName) {
    if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
  }

  private static String dropTableStatement(String tableName) {
    return "DROP TABLE IF EXISTS " + tableName + " CASCADE";
  }

  private static String columnDefinition(DatasetColumn column) {
    if (column.name() == null) {
      throw new IllegalStateException(
          "Column '" + column.sourceName() + "' has not been sanitized");
    }
    return quote(column.name()) + " " + sqlType(column.type());
  }
}
