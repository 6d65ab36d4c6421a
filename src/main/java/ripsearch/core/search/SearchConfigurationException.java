package ripsearch.core.search;

public class SearchConfigurationException extends RuntimeException {
  public SearchConfigurationException(String message) {
    super(message);
  }

  public SearchConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
