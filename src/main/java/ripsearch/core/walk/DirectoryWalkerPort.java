package ripsearch.core.walk;

import java.nio.file.Path;
import ripsearch.core.search.SearchOptions;

public interface DirectoryWalkerPort {
  /**
   * Validates filters and prepares a walk. Nothing under {@code root} is read here except ignore
   * files above it.
   *
   * @throws ripsearch.core.search.InvalidGlobException for a malformed include/exclude glob
   * @throws ripsearch.core.search.InvalidTypeFilterException for an unknown file type name
   */
  WalkPlan build(Path root, SearchOptions options);
}
