package com.foo.sheetimport.dataset;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single spreadsheet cell as a tagged variant.
 *
 * <p>The payload type is fixed by the tag: {@code TEXT} carries a {@link String},
 * {@code INTEGER} a {@link Long}, {@code DECIMAL} a {@link BigDecimal}, {@code BOOLEAN} a
 * {@link Boolean} and {@code TIMESTAMP} a {@link LocalDateTime}. {@code NULL} carries nothing.
 */
public record CellValue(ValueKind kind, Object value) {

  public static final CellValue NULL = new CellValue(ValueKind.NULL, null);

  public CellValue {
    Objects.requireNonNull(kind, "kind");
    Class<?> expected =
        switch (kind) {
          case NULL -> null;
          case TEXT -> String.class;
          case INTEGER -> Long.class;
          case DECIMAL -> BigDecimal.class;
          case BOOLEAN -> Boolean.class;
          case TIMESTAMP -> LocalDateTime.class;
        };
    if (expected == null) {
      if (value != null) {
        throw new IllegalArgumentException("NULL cell cannot carry a value");
      }
    } else if (!expected.isInstance(value)) {
      throw new IllegalArgumentException(
          "%s cell requires %s but got %s"
              .formatted(kind, expected.getSimpleName(), value == null ? "null" : value.getClass()));
    }
  }

  public static CellValue text(String value) {
    return value == null ? NULL : new CellValue(ValueKind.TEXT, value);
  }

  public static CellValue integer(long value) {
    return new CellValue(ValueKind.INTEGER, value);
  }

  public static CellValue decimal(BigDecimal value) {
    return value == null ? NULL : new CellValue(ValueKind.DECIMAL, value);
  }

  public static CellValue bool(boolean value) {
    return new CellValue(ValueKind.BOOLEAN, value);
  }

  public static CellValue timestamp(LocalDateTime value) {
    return value == null ? NULL : new CellValue(ValueKind.TIMESTAMP, value);
  }

  public boolean isNull() {
    return kind == ValueKind.NULL;
  }

  /** Null, or text that is empty after trimming. */
  public boolean isBlank() {
    return isNull() || (kind == ValueKind.TEXT && ((String) value).isBlank());
  }

  public String asText() {
    return switch (kind) {
      case NULL -> null;
      case DECIMAL -> ((BigDecimal) value).toPlainString();
      default -> value.toString();
    };
  }

  public long asLong() {
    return switch (kind) {
      case INTEGER -> (Long) value;
      case DECIMAL -> ((BigDecimal) value).longValueExact();
      default -> throw new IllegalStateException(kind + " cell is not numeric");
    };
  }

  public BigDecimal asDecimal() {
    return switch (kind) {
      case INTEGER -> BigDecimal.valueOf((Long) value);
      case DECIMAL -> (BigDecimal) value;
      default -> throw new IllegalStateException(kind + " cell is not numeric");
    };
  }

  public boolean asBoolean() {
    if (kind != ValueKind.BOOLEAN) {
      throw new IllegalStateException(kind + " cell is not boolean");
    }
    return (Boolean) value;
  }

  public LocalDateTime asTimestamp() {
    if (kind != ValueKind.TIMESTAMP) {
      throw new IllegalStateException(kind + " cell is not a timestamp");
    }
    return (LocalDateTime) value;
  }
}
