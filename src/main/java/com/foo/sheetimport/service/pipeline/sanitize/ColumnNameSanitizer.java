package com.foo.sheetimport.service.pipeline.sanitize;

import com.foo.sheetimport.dataset.Dataset;
import com.foo.sheetimport.dataset.DatasetColumn;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw header text into unique lowercase identifiers that are safe to use as column names.
 *
 * <p>Resolution is order dependent: the first column to produce a name keeps it and later
 * collisions get {@code _1}, {@code _2}, ... Running the sanitizer again over names that already
 * carry such suffixes is therefore not guaranteed to return the same list.
 */
@Slf4j
@Component
public class ColumnNameSanitizer {

  public static final String PRIMARY_KEY_COLUMN = "id";
  public static final String CREATED_AT_COLUMN = "created_at";
  public static final String UPDATED_AT_COLUMN = "updated_at";

  /** PostgreSQL NAMEDATALEN - 1. Longer identifiers are silently truncated by the server. */
  public static final int MAX_IDENTIFIER_LENGTH = 63;

  private static final String RENAMED_PREFIX = "original_";
  private static final String PLACEHOLDER_PREFIX = "column_";
  private static final Set<String> RESERVED_NAMES =
      Set.of(PRIMARY_KEY_COLUMN, CREATED_AT_COLUMN, UPDATED_AT_COLUMN);

  private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
  private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-z0-9_]");

  public Dataset sanitize(Dataset dataset) {
    List<String> rawNames = dataset.columns().stream().map(DatasetColumn::sourceName).toList();
    List<String> resolved = sanitize(rawNames);

    List<DatasetColumn> columns = new ArrayList<>(resolved.size());
    for (int i = 0; i < resolved.size(); i++) {
      columns.add(dataset.columns().get(i).withName(resolved.get(i)));
    }
    log.info("Cleaned column names: {}", resolved);
    return dataset.withColumns(columns);
  }

  public List<String> sanitize(List<String> rawNames) {
    List<String> resolved = new ArrayList<>(rawNames.size());
    Set<String> used = new HashSet<>();
    Map<String, Integer> nextSuffix = new HashMap<>();

    for (int index = 0; index < rawNames.size(); index++) {
      String name = normalize(rawNames.get(index));
      if (name.isEmpty() || "nan".equals(name)) {
        name = PLACEHOLDER_PREFIX + index;
      }
      if (RESERVED_NAMES.contains(name)) {
        log.info(
            "Renamed '{}' column to '{}' to avoid conflict with a generated column",
            name,
            RENAMED_PREFIX + name);
        name = RENAMED_PREFIX + name;
      }
      name = truncate(name, MAX_IDENTIFIER_LENGTH);
      name = makeUnique(name, used, nextSuffix);
      used.add(name);
      resolved.add(name);
    }
    return resolved;
  }

  static String normalize(String rawName) {
    if (rawName == null) {
      return "";
    }
    String name = rawName.strip();
    name = PUNCTUATION.matcher(name).replaceAll("");
    name = WHITESPACE_RUN.matcher(name).replaceAll("_");
    name = name.toLowerCase(Locale.ROOT);
    return NON_IDENTIFIER.matcher(name).replaceAll("");
  }

  private String makeUnique(String base, Set<String> used, Map<String, Integer> nextSuffix) {
    if (!used.contains(base)) {
      return base;
    }
    int suffix = nextSuffix.getOrDefault(base, 1);
    String candidate = withSuffix(base, suffix);
    while (used.contains(candidate)) {
      suffix++;
      candidate = withSuffix(base, suffix);
    }
    nextSuffix.put(base, suffix + 1);
    return candidate;
  }

  // 접미사를 붙여도 식별자 길이 제한을 넘지 않도록 base 를 자른다
  private static String withSuffix(String base, int suffix) {
    String tail = "_" + suffix;
    return truncate(base, MAX_IDENTIFIER_LENGTH - tail.length()) + tail;
  }

  private static String truncate(String name, int maxLength) {
    return name.length() <= maxLength ? name : name.substring(0, maxLength);
  }
}
