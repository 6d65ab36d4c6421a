package ripsearch.platform.delivery.web;

import java.util.List;
import ripsearch.core.search.SearchResult;
import ripsearch.core.search.SearchStats;

public record TextSearchResponse(
    String pattern,
    String root,
    List<TextSearchMatchLine> matches,
    SearchStats stats,
    List<String> errors,
    boolean cancelled,
    String error) {
  static TextSearchResponse of(String pattern, String root, SearchResult result) {
    return new TextSearchResponse(
        pattern,
        root,
        result.matches().stream().map(TextSearchMatchLine::from).toList(),
        result.stats(),
        result.errors(),
        result.cancelled(),
        null);
  }

  static TextSearchResponse failed(String pattern, String root, String error) {
    return new TextSearchResponse(
        pattern, root, List.of(), SearchStats.empty(), List.of(), false, error);
  }
}
