package io.intellixity.paginator.sort;

import io.intellixity.paginator.error.ConfigurationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * A validated sort column reference: {@code column} or {@code table.column}.
 *
 * <p>Executors resolve identifiers segment by segment, so more than one separator or an empty
 * segment is rejected up front.</p>
 */
public record ColumnIdentifier(String table, String column) {
  private static final Pattern PATTERN = Pattern.compile("^(?:[^.]+\\.)?[^.]+$");

  public static ColumnIdentifier parse(String identifier) {
    if (identifier == null || !PATTERN.matcher(identifier).matches() || identifier.isBlank()) {
      throw new ConfigurationException("Invalid column identifier '" + identifier + "'",
          Map.of("column", String.valueOf(identifier)));
    }
    int dot = identifier.indexOf('.');
    return dot < 0
        ? new ColumnIdentifier(null, identifier)
        : new ColumnIdentifier(identifier.substring(0, dot), identifier.substring(dot + 1));
  }

  public boolean qualified() {
    return table != null;
  }

  @Override
  public String toString() {
    return table == null ? column : table + "." + column;
  }
}
