package ripsearch.core.search;

public interface PatternCompilerPort {
  PatternMatcher compile(String pattern, SearchOptions options);
}
