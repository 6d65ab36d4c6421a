package ripsearch.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SearchLocationTest {
  @Test
  void parse_readsPathLineAndColumn() {
    assertEquals(
        Optional.of(new SearchLocation("src/a.txt", 12, 4)),
        SearchLocation.parse("src/a.txt:12:4: hello: world"));
  }

  @Test
  void parse_keepsDriveLetterInPath() {
    assertEquals(
        Optional.of(new SearchLocation("C:\\work\\a.txt", 3, 0)),
        SearchLocation.parse("C:\\work\\a.txt:3:0: text"));
  }

  @Test
  void parse_defaultsColumnWhenAbsent() {
    assertEquals(
        Optional.of(new SearchLocation("a.txt", 7, 0)), SearchLocation.parse("a.txt:7: text"));
  }

  @Test
  void parse_rejectsNonMatchLines() {
    assertTrue(SearchLocation.parse(null).isEmpty());
    assertTrue(SearchLocation.parse("   ").isEmpty());
    assertTrue(SearchLocation.parse("2 RESULTS ACROSS 1 FILE. Search completed.").isEmpty());
    assertTrue(SearchLocation.parse("a.txt-2- context line").isEmpty());
    assertTrue(SearchLocation.parse(":5:1: no path").isEmpty());
    assertTrue(SearchLocation.parse("a.txt:0:1: zero line").isEmpty());
  }
}
