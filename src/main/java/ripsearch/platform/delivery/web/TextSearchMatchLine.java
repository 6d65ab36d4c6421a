package ripsearch.platform.delivery.web;

import ripsearch.core.search.SearchMatch;

public record TextSearchMatchLine(
    String path, long lineNumber, int column, String lineText, boolean context) {
  static TextSearchMatchLine from(SearchMatch match) {
    return new TextSearchMatchLine(
        match.path().toString(),
        match.lineNumber(),
        match.column(),
        match.text(),
        match.context());
  }
}
