package ripsearch.platform.adapters.regex;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.stereotype.Component;
import ripsearch.core.search.InvalidPatternException;
import ripsearch.core.search.PatternCompilerPort;
import ripsearch.core.search.PatternMatcher;
import ripsearch.core.search.SearchOptions;

@Component
public class JavaRegexPatternCompiler implements PatternCompilerPort {
  @Override
  public PatternMatcher compile(String pattern, SearchOptions options) {
    if (pattern == null) {
      throw new InvalidPatternException(null, "Invalid pattern: pattern must not be null.");
    }

    int flags = 0;
    if (options.caseInsensitive() || (options.smartCase() && isAllLowercase(pattern, options))) {
      flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    }
    if (options.multiline()) {
      flags |= Pattern.MULTILINE;
    }

    String expression = options.fixedStrings() ? Pattern.quote(pattern) : pattern;
    if (options.wordBoundary()) {
      expression = "(?<!\\w)(?:" + expression + ")(?!\\w)";
    }

    try {
      return new RegexPatternMatcher(Pattern.compile(expression, flags));
    } catch (PatternSyntaxException e) {
      throw new InvalidPatternException(pattern, "Invalid pattern: " + e.getDescription());
    } catch (IllegalArgumentException e) {
      throw new InvalidPatternException(pattern, "Invalid pattern: " + e.getMessage());
    }
  }

  static boolean isAllLowercase(String pattern, SearchOptions options) {
    boolean sawLetter = false;
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (!options.fixedStrings() && c == '\\') {
        // Escapes such as \S or \W are classes, not literal uppercase characters.
        i++;
        continue;
      }
      if (Character.isUpperCase(c)) {
        return false;
      }
      if (Character.isLetter(c)) {
        sawLetter = true;
      }
    }
    return sawLetter;
  }
}
