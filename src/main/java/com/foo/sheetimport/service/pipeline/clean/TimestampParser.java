package com.foo.sheetimport.service.pipeline.clean;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Lenient-format, strict-value parsing of date and date-time text. */
final class TimestampParser {

  private static final List<DateTimeFormatter> FORMATTERS =
      List.of(
          withOptionalTime("uuuu-M-d"),
          withOptionalTime("uuuu/M/d"),
          withOptionalTime("uuuu.M.d"),
          withOptionalTime("M/d/uuuu"),
          new DateTimeFormatterBuilder()
              .appendPattern("uuuuMMdd")
              .toFormatter(Locale.ROOT)
              .withResolverStyle(ResolverStyle.STRICT));

  private TimestampParser() {}

  static Optional<LocalDateTime> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String value = text.strip();
    for (DateTimeFormatter formatter : FORMATTERS) {
      Optional<LocalDateTime> parsed = tryParse(formatter, value);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    try {
      return Optional.of(OffsetDateTime.parse(value).toLocalDateTime());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDateTime> tryParse(DateTimeFormatter formatter, String value) {
    try {
      TemporalAccessor parsed = formatter.parseBest(value, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof LocalDateTime) {
        return Optional.of((LocalDateTime) parsed);
      }
      return Optional.of(((LocalDate) parsed).atStartOfDay());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter withOptionalTime(String datePattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(datePattern)
        .optionalStart()
        .optionalStart()
        .appendLiteral('T')
        .optionalEnd()
        .optionalStart()
        .appendLiteral(' ')
        .optionalEnd()
        .appendPattern("H:mm")
        .optionalStart()
        .appendPattern(":ss")
        .optionalEnd()
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
