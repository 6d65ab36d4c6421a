package ripsearch.core.search;

import java.util.Locale;

public final class SearchReportFormatter {
  private SearchReportFormatter() {}

  public static String format(SearchResult result) {
    SearchStats stats = result.stats();
    StringBuilder output = new StringBuilder();

    output
        .append(stats.matches())
        .append(stats.matches() == 1 ? " RESULT" : " RESULTS")
        .append(" ACROSS ")
        .append(stats.filesSearched())
        .append(stats.filesSearched() == 1 ? " FILE" : " FILES")
        .append(". Search completed in ")
        .append(formatDuration(stats.elapsedMillis()))
        .append(".\n\n");

    for (SearchMatch match : result.matches()) {
      output.append(match.path()).append(match.context() ? '-' : ':').append(match.lineNumber());
      if (match.context()) {
        output.append("- ");
      } else {
        output.append(':').append(match.column()).append(": ");
      }
      output.append(match.text()).append('\n');
    }

    if (!result.errors().isEmpty()) {
      output.append('\n').append(result.errors().size()).append(" errors encountered:\n");
      for (String error : result.errors()) {
        output.append("  ").append(error).append('\n');
      }
    }

    return output.toString();
  }

  public static String formatDuration(long millis) {
    if (millis < 1_000) {
      return millis + " ms";
    }
    if (millis < 60_000) {
      double seconds = millis / 1000.0;
      if (seconds < 10.0) {
        return String.format(Locale.ROOT, "%.1f seconds", seconds);
      }
      return (millis / 1_000) + " seconds";
    }
    if (millis < 3_600_000) {
      long minutes = millis / 60_000;
      long seconds = (millis % 60_000) / 1_000;
      return seconds > 0 ? minutes + " minutes " + seconds + " seconds" : minutes + " minutes";
    }
    long hours = millis / 3_600_000;
    long minutes = (millis % 3_600_000) / 60_000;
    return hours + " hours " + minutes + " minutes";
  }
}
