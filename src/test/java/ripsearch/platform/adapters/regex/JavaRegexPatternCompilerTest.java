package ripsearch.platform.adapters.regex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import ripsearch.core.search.InvalidPatternException;
import ripsearch.core.search.PatternMatcher;
import ripsearch.core.search.SearchOptions;

class JavaRegexPatternCompilerTest {
  private final JavaRegexPatternCompiler compiler = new JavaRegexPatternCompiler();

  @Test
  void smartCase_lowercasePatternIgnoresCase() {
    PatternMatcher matcher = compiler.compile("foo", SearchOptions.defaults());

    assertTrue(matcher.isMatch("FOO bar"));
  }

  @Test
  void smartCase_uppercaseLetterMakesPatternCaseSensitive() {
    PatternMatcher matcher = compiler.compile("Foo", SearchOptions.defaults());

    assertTrue(matcher.isMatch("Foo"));
    assertFalse(matcher.isMatch("foo"));
  }

  @Test
  void smartCase_ignoresEscapedClasses() {
    PatternMatcher matcher = compiler.compile("foo\\S+", SearchOptions.defaults());

    assertTrue(matcher.isMatch("FOOBAR"));
    assertTrue(JavaRegexPatternCompiler.isAllLowercase("\\Wfoo", SearchOptions.defaults()));
    assertFalse(JavaRegexPatternCompiler.isAllLowercase("123", SearchOptions.defaults()));
  }

  @Test
  void caseSensitive_whenSmartCaseOff() {
    PatternMatcher matcher =
        compiler.compile("foo", SearchOptions.builder().smartCase(false).build());

    assertFalse(matcher.isMatch("FOO"));
  }

  @Test
  void caseInsensitive_overridesUppercasePattern() {
    PatternMatcher matcher =
        compiler.compile("FOO", SearchOptions.builder().caseInsensitive(true).build());

    assertTrue(matcher.isMatch("foo"));
  }

  @Test
  void wordBoundary_rejectsMatchesInsideWords() {
    PatternMatcher matcher =
        compiler.compile("foo", SearchOptions.builder().wordBoundary(true).build());

    assertTrue(matcher.isMatch("a foo b"));
    assertTrue(matcher.isMatch("(foo)"));
    assertFalse(matcher.isMatch("foobar"));
    assertFalse(matcher.isMatch("_foo"));
  }

  @Test
  void fixedStrings_treatsMetacharactersLiterally() {
    PatternMatcher matcher =
        compiler.compile("a.b(", SearchOptions.builder().fixedStrings(true).build());

    assertTrue(matcher.isMatch("x a.b( y"));
    assertFalse(matcher.isMatch("axb("));
  }

  @Test
  void invalidPattern_reportsPatternAndDiagnostic() {
    InvalidPatternException e =
        assertThrows(
            InvalidPatternException.class,
            () -> compiler.compile("foo(", SearchOptions.defaults()));

    assertEquals("foo(", e.pattern());
    assertTrue(e.getMessage().startsWith("Invalid pattern:"));
  }

  @Test
  void locate_returnsUtf8ByteOffset() {
    PatternMatcher matcher = compiler.compile("foo", SearchOptions.defaults());

    assertEquals(OptionalInt.of(7), matcher.locate("héllo foo"));
    assertEquals(OptionalInt.of(0), matcher.locate("foo"));
    assertEquals(OptionalInt.empty(), matcher.locate("bar"));
  }

  @Test
  void findAll_returnsEveryRegion() {
    PatternMatcher matcher = compiler.compile("o+", SearchOptions.defaults());

    assertEquals(
        List.of(new PatternMatcher.MatchRegion(1, 3), new PatternMatcher.MatchRegion(5, 6)),
        matcher.findAll("foo bo"));
  }
}
