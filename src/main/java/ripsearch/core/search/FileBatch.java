package ripsearch.core.search;

import java.nio.file.Path;
import java.util.List;

public record FileBatch(Path path, List<SearchMatch> matches) {
  public FileBatch {
    matches = List.copyOf(matches);
  }
}
