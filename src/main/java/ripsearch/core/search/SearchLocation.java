package ripsearch.core.search;

import java.util.Arrays;
import java.util.Optional;

/** A jump target read back from one match line of a formatted report. */
public record SearchLocation(String path, int line, int column) {
  public static Optional<SearchLocation> parse(String reportLine) {
    if (reportLine == null || reportLine.isBlank()) {
      return Optional.empty();
    }

    // path:line:column: text, where path may itself hold a drive-letter colon.
    String[] parts = reportLine.split(":", -1);
    for (int i = 1; i < parts.length; i++) {
      Integer line = parsePositive(parts[i]);
      if (line == null) {
        continue;
      }
      String path = String.join(":", Arrays.copyOfRange(parts, 0, i));
      if (path.isBlank()) {
        return Optional.empty();
      }
      int column = 0;
      if (i + 1 < parts.length) {
        Integer parsedColumn = parseNonNegative(parts[i + 1]);
        if (parsedColumn != null) {
          column = parsedColumn;
        }
      }
      return Optional.of(new SearchLocation(path, line, column));
    }
    return Optional.empty();
  }

  private static Integer parsePositive(String value) {
    Integer parsed = parseNonNegative(value);
    return parsed == null || parsed == 0 ? null : parsed;
  }

  private static Integer parseNonNegative(String value) {
    if (value.isEmpty() || value.length() > 9) {
      return null;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return null;
      }
    }
    return Integer.parseInt(value);
  }
}
