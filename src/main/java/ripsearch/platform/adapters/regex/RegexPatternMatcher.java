package ripsearch.platform.adapters.regex;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import ripsearch.core.search.PatternMatcher;

final class RegexPatternMatcher implements PatternMatcher {
  private final Pattern pattern;

  RegexPatternMatcher(Pattern pattern) {
    this.pattern = pattern;
  }

  @Override
  public boolean isMatch(CharSequence line) {
    return pattern.matcher(line).find();
  }

  @Override
  public OptionalInt locate(CharSequence line) {
    Matcher matcher = pattern.matcher(line);
    if (!matcher.find()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(utf8Length(line, matcher.start()));
  }

  @Override
  public List<MatchRegion> findAll(CharSequence text) {
    Matcher matcher = pattern.matcher(text);
    List<MatchRegion> regions = new ArrayList<>();
    while (matcher.find()) {
      regions.add(new MatchRegion(matcher.start(), matcher.end()));
    }
    return regions;
  }

  @Override
  public String toString() {
    return pattern.pattern();
  }

  private static int utf8Length(CharSequence text, int endExclusive) {
    return text.subSequence(0, endExclusive).toString().getBytes(StandardCharsets.UTF_8).length;
  }
}
