package com.flamingo.ai.webarchive.service.importing;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flamingo.ai.webarchive.exception.ImportValidationException;
import com.flamingo.ai.webarchive.service.ingest.UrlNormalizer;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses bookmark export tables (Pocket format) into {@link ImportItem}s.
 *
 * <p>Columns are located by header name; without a recognizable header the Pocket column order
 * {@code url,title,tags,time_added,time_read,archive} is assumed. Rows without an http(s) url are
 * skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportListParser {

  private static final List<String> DEFAULT_COLUMNS =
      List.of("url", "title", "tags", "time_added", "time_read", "archive");
  private static final int VALIDATION_SAMPLE_ROWS = 9;

  private static final ObjectReader ROW_READER =
      new CsvMapper()
          .readerFor(String[].class)
          .with(CsvParser.Feature.WRAP_AS_ARRAY)
          .with(CsvParser.Feature.TRIM_SPACES);

  private final UrlNormalizer urlNormalizer;

  /**
   * Rejects input that is clearly not an import list.
   *
   * @throws ImportValidationException if there is no data row, the header lacks url and title, or
   *     none of the first rows contains an http url
   */
  public void validate(String csvContent) {
    if (csvContent == null || csvContent.isBlank()) {
      throw new ImportValidationException("CSV file appears to be empty or has no data rows");
    }
    String[] lines = csvContent.split("\n");
    if (lines.length < 2) {
      throw new ImportValidationException("CSV file appears to be empty or has no data rows");
    }
    String header = lines[0].toLowerCase(Locale.ROOT);
    if (!header.contains("url") || !header.contains("title")) {
      throw new ImportValidationException(
          "CSV file does not appear to be a Pocket export (missing URL and Title columns)");
    }
    int last = Math.min(lines.length, VALIDATION_SAMPLE_ROWS + 1);
    for (int i = 1; i < last; i++) {
      if (lines[i].contains("http")) {
        return;
      }
    }
    throw new ImportValidationException("No valid URLs found in CSV file");
  }

  /**
   * Parses every readable row. A malformed row is skipped on its own; rows after it are still
   * read.
   */
  public List<ImportItem> parse(String csvContent) {
    List<ImportItem> items = new ArrayList<>();
    if (csvContent == null || csvContent.isBlank()) {
      return items;
    }

    Map<String, Integer> columns = null;
    int malformed = 0;
    for (String record : records(csvContent)) {
      if (record.isBlank()) {
        continue;
      }
      String[] row = readRow(record);
      if (row == null) {
        malformed++;
        continue;
      }
      if (columns == null) {
        columns = headerColumns(row);
        if (columns != null) {
          continue;
        }
        columns = positional();
      }
      ImportItem item = toItem(row, columns);
      if (item != null) {
        items.add(item);
      }
    }

    if (malformed > 0) {
      log.warn("Skipped {} malformed rows in import list", malformed);
    }
    log.info("Parsed {} URLs from import list", items.size());
    return items;
  }

  /**
   * Splits the table into records at line breaks outside quoted fields. From a quote that is never
   * closed, the rest of the input is split into plain lines.
   */
  static List<String> records(String csvContent) {
    List<String> records = new ArrayList<>();
    int start = 0;
    boolean quoted = false;
    for (int i = 0; i < csvContent.length(); i++) {
      char c = csvContent.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (c == '\n' && !quoted) {
        records.add(csvContent.substring(start, i));
        start = i + 1;
      }
    }
    if (start < csvContent.length()) {
      String tail = csvContent.substring(start);
      if (quoted) {
        records.addAll(List.of(tail.split("\n")));
      } else {
        records.add(tail);
      }
    }
    return records;
  }

  /** One record's cells, or null if the record is not valid CSV. */
  private static String[] readRow(String record) {
    try (MappingIterator<String[]> rows = ROW_READER.readValues(record)) {
      return rows.hasNextValue() ? rows.nextValue() : null;
    } catch (IOException | RuntimeException e) {
      log.debug("Skipping malformed import row: {}", e.getMessage());
      return null;
    }
  }

  private ImportItem toItem(String[] row, Map<String, Integer> columns) {
    String url = cell(row, columns, "url");
    if (url.isEmpty() || !url.startsWith("http")) {
      return null;
    }
    return new ImportItem(
        urlNormalizer.normalize(url),
        cell(row, columns, "title"),
        splitTags(cell(row, columns, "tags")),
        parseTime(cell(row, columns, "time_added")),
        isTruthy(cell(row, columns, "archive"))
            || "archive".equalsIgnoreCase(cell(row, columns, "status")));
  }

  /** Column positions from a header row, or null if the row is data. */
  private static Map<String, Integer> headerColumns(String[] row) {
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 0; i < row.length; i++) {
      String name = row[i].trim().toLowerCase(Locale.ROOT).replace(' ', '_');
      columns.putIfAbsent(name, i);
    }
    return columns.containsKey("url") ? columns : null;
  }

  private static Map<String, Integer> positional() {
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 0; i < DEFAULT_COLUMNS.size(); i++) {
      columns.put(DEFAULT_COLUMNS.get(i), i);
    }
    return columns;
  }

  private static String cell(String[] row, Map<String, Integer> columns, String name) {
    Integer index = columns.get(name);
    if (index == null || index >= row.length || row[index] == null) {
      return "";
    }
    return row[index].trim();
  }

  /** Tags are comma- or pipe-separated depending on the export version. */
  static List<String> splitTags(String raw) {
    Set<String> tags = new LinkedHashSet<>();
    for (String tag : raw.split("[,|]")) {
      String trimmed = tag.trim();
      if (!trimmed.isEmpty()) {
        tags.add(trimmed);
      }
    }
    return new ArrayList<>(tags);
  }

  /** Epoch seconds or ISO-8601; anything else means "now". */
  static Instant parseTime(String raw) {
    if (raw.isEmpty()) {
      return Instant.now();
    }
    try {
      if (raw.chars().allMatch(Character::isDigit)) {
        return Instant.ofEpochSecond(Long.parseLong(raw));
      }
      return Instant.parse(raw);
    } catch (DateTimeException | NumberFormatException e) {
      log.debug("Unreadable time_added '{}', using now", raw);
      return Instant.now();
    }
  }

  private static boolean isTruthy(String value) {
    return "1".equals(value) || "true".equalsIgnoreCase(value);
  }
}
