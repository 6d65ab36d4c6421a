package ripsearch.core.search;

public class InvalidPatternException extends SearchConfigurationException {
  private final String pattern;

  public InvalidPatternException(String pattern, String message) {
    super(message);
    this.pattern = pattern;
  }

  public String pattern() {
    return pattern;
  }
}
