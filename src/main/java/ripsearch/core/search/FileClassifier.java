package ripsearch.core.search;

import ripsearch.core.walk.WalkEntry;

/** Applies the per-file size limit using the size the walker already read. */
public class FileClassifier {
  private final Long maxFilesize;

  public FileClassifier(SearchOptions options) {
    this.maxFilesize = options.hasMaxFilesize() ? options.maxFilesize() : null;
  }

  public boolean accept(WalkEntry entry) {
    return maxFilesize == null || entry.size() <= maxFilesize;
  }
}
