package ripsearch.core.search;

import java.nio.file.Path;

public record SearchMatch(Path path, long lineNumber, int column, String text, boolean context) {
  public static SearchMatch match(Path path, long lineNumber, int column, String text) {
    return new SearchMatch(path, lineNumber, column, text, false);
  }

  public static SearchMatch contextLine(Path path, long lineNumber, String text) {
    return new SearchMatch(path, lineNumber, 0, text, true);
  }
}
