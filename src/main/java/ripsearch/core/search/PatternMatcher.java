package ripsearch.core.search;

import java.util.List;
import java.util.OptionalInt;

/**
 * Compiled, immutable pattern. Implementations must be safe to share between worker threads.
 */
public interface PatternMatcher {
  boolean isMatch(CharSequence line);

  /** UTF-8 byte offset of the first match in {@code line}, if any. */
  OptionalInt locate(CharSequence line);

  /** Every non-overlapping match in {@code text}, as char offsets. */
  List<MatchRegion> findAll(CharSequence text);

  record MatchRegion(int start, int end) {}
}
