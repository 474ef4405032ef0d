package com.foo.sheetimport.service.pipeline.clean;

import com.foo.sheetimport.dataset.CellValue;
import com.foo.sheetimport.dataset.ColumnType;
import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetColumn;
import com.foo.sheetimport.dataset.DatasetRow;
import com.foo.sheetimport.dataset.ValueKind;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns one {@link ColumnType} per column from the values of the whole column and converts the
 * column's cells to match.
 *
 * <p>Columns whose name mentions a date or time are parsed as timestamps. Other columns keep a
 * uniform spreadsheet-native type, or are promoted to a number when enough of their values parse
 * as one. Promotion is all or nothing for a column: cells that do not fit become null.
 */
@Slf4j
@Component
public class TypeInferrer {

  /** Share of non-null values that must parse as numbers for a column to become numeric. */
  public static final double NUMERIC_PROMOTION_THRESHOLD = 0.8;

  // BIGINT 자릿수를 넘거나 소수 자릿수가 과도한 값은 숫자로 보지 않음
  static final int MAX_INTEGER_DIGITS = 19;
  static final int MAX_FRACTION_DIGITS = 38;

  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
  private static final Set<ValueKind> NUMERIC_KINDS = EnumSet.of(ValueKind.INTEGER, ValueKind.DECIMAL);

  public Dataset infer(Dataset dataset) {
    int columnCount = dataset.columnCount();
    List<DatasetColumn> columns = new ArrayList<>(columnCount);
    List<List<CellValue>> converted = new ArrayList<>(dataset.rowCount());
    for (int r = 0; r < dataset.rowCount(); r++) {
      converted.add(new ArrayList<>(dataset.rows().get(r).values()));
    }

    for (int c = 0; c < columnCount; c++) {
      DatasetColumn column = dataset.columns().get(c);
      List<CellValue> values = columnValues(dataset, c);
      TypedColumn typed = inferColumn(column.name(), values);
      columns.add(column.withType(typed.type()));
      for (int r = 0; r < converted.size(); r++) {
        converted.get(r).set(c, typed.values().get(r));
      }
    }

    List<DatasetRow> rows = new ArrayList<>(converted.size());
    for (int r = 0; r < converted.size(); r++) {
      rows.add(new DatasetRow(dataset.rows().get(r).sourceRowNumber(), converted.get(r)));
    }

    log.info("Data types after cleaning:");
    columns.forEach(column -> log.info("  {}: {}", column.name(), column.type()));
    return new Dataset(columns, rows);
  }

  TypedColumn inferColumn(String columnName, List<CellValue> values) {
    if (isTemporalName(columnName)) {
      log.info("Converted column '{}' to timestamp", columnName);
      return new TypedColumn(ColumnType.TIMESTAMP, values.stream().map(this::toTimestamp).toList());
    }

    Set<ValueKind> kinds = EnumSet.noneOf(ValueKind.class);
    values.stream().filter(v -> !v.isNull()).forEach(v -> kinds.add(v.kind()));

    if (kinds.isEmpty()) {
      return new TypedColumn(ColumnType.TEXT, values);
    }
    if (kinds.equals(EnumSet.of(ValueKind.INTEGER))) {
      return new TypedColumn(ColumnType.INTEGER, values);
    }
    if (NUMERIC_KINDS.containsAll(kinds)) {
      return new TypedColumn(ColumnType.DECIMAL, values.stream().map(this::toDecimal).toList());
    }
    if (kinds.equals(EnumSet.of(ValueKind.BOOLEAN))) {
      return new TypedColumn(ColumnType.BOOLEAN, values);
    }
    if (kinds.equals(EnumSet.of(ValueKind.TIMESTAMP))) {
      return new TypedColumn(ColumnType.TIMESTAMP, values);
    }

    List<CellValue> texts =
        values.stream().map(v -> v.isNull() ? v : CellValue.text(v.asText())).toList();
    return promoteNumeric(columnName, texts).orElseGet(() -> new TypedColumn(ColumnType.TEXT, texts));
  }

  private Optional<TypedColumn> promoteNumeric(String columnName, List<CellValue> texts) {
    int nonNull = 0;
    List<BigDecimal> parsed = new ArrayList<>(texts.size());
    for (CellValue value : texts) {
      if (value.isNull()) {
        parsed.add(null);
        continue;
      }
      nonNull++;
      parsed.add(parseNumber(value.asText()));
    }

    long parseable = parsed.stream().filter(Objects::nonNull).count();
    if (parseable == 0 || (double) parseable / nonNull < NUMERIC_PROMOTION_THRESHOLD) {
      return Optional.empty();
    }

    boolean integral = parsed.stream().filter(Objects::nonNull).allMatch(TypeInferrer::fitsLong);
    List<CellValue> numbers = new ArrayList<>(parsed.size());
    for (BigDecimal number : parsed) {
      if (number == null) {
        numbers.add(CellValue.NULL);
      } else if (integral) {
        numbers.add(CellValue.integer(number.longValueExact()));
      } else {
        numbers.add(CellValue.decimal(number));
      }
    }
    log.info(
        "Converted column '{}' to numeric ({} of {} values parsed)", columnName, parseable, nonNull);
    return Optional.of(new TypedColumn(integral ? ColumnType.INTEGER : ColumnType.DECIMAL, numbers));
  }

  private CellValue toTimestamp(CellValue value) {
    return switch (value.kind()) {
      case TIMESTAMP -> value;
      case TEXT, INTEGER, DECIMAL ->
          TimestampParser.parse(value.asText()).map(CellValue::timestamp).orElse(CellValue.NULL);
      default -> CellValue.NULL;
    };
  }

  private CellValue toDecimal(CellValue value) {
    return value.isNull() ? value : CellValue.decimal(value.asDecimal());
  }

  private static boolean isTemporalName(String columnName) {
    if (columnName == null) {
      return false;
    }
    String lower = columnName.toLowerCase(Locale.ROOT);
    return lower.contains("date") || lower.contains("time");
  }

  static BigDecimal parseNumber(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    BigDecimal number;
    try {
      number = new BigDecimal(text.strip());
    } catch (NumberFormatException e) {
      return null;
    }
    if (number.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return isStorable(number) ? number : null;
  }

  /** Rejects exponents no SQL numeric column can hold, such as {@code 1e999999999}. */
  private static boolean isStorable(BigDecimal number) {
    BigDecimal stripped = number.stripTrailingZeros();
    long integerDigits = (long) stripped.precision() - stripped.scale();
    return integerDigits <= MAX_INTEGER_DIGITS && stripped.scale() <= MAX_FRACTION_DIGITS;
  }

  private static boolean fitsLong(BigDecimal number) {
    return number.stripTrailingZeros().scale() <= 0
        && number.compareTo(LONG_MIN) >= 0
        && number.compareTo(LONG_MAX) <= 0;
  }

  private static List<CellValue> columnValues(Dataset dataset, int columnIndex) {
    return dataset.rows().stream().map(row -> row.get(columnIndex)).toList();
  }

  record TypedColumn(ColumnType type, List<CellValue> values) {}
}
