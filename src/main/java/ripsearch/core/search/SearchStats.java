package ripsearch.core.search;

public record SearchStats(long matches, long filesSearched, long filesMatched, long elapsedMillis) {
  public static SearchStats empty() {
    return new SearchStats(0, 0, 0, 0);
  }
}
