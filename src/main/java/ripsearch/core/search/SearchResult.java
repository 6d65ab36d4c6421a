package ripsearch.core.search;

import java.util.List;

public record SearchResult(
    List<SearchMatch> matches, SearchStats stats, List<String> errors, boolean cancelled) {
  public SearchResult {
    matches = matches == null ? List.of() : List.copyOf(matches);
    errors = errors == null ? List.of() : List.copyOf(errors);
    stats = stats == null ? SearchStats.empty() : stats;
  }
}
