package ripsearch.core.search;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface FileSearcherPort {
  /**
   * Scans one file and returns its matched lines (plus configured context lines) in line order.
   *
   * @throws BinaryFileException when the file holds a NUL byte
   * @throws java.nio.charset.CharacterCodingException when the file is not valid UTF-8
   */
  List<SearchMatch> search(PatternMatcher matcher, Path path, SearchOptions options)
      throws IOException;
}
