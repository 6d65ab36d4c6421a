package ripsearch.core.search;

public class InvalidGlobException extends SearchConfigurationException {
  private final String glob;

  public InvalidGlobException(String glob, String message, Throwable cause) {
    super(message, cause);
    this.glob = glob;
  }

  public String glob() {
    return glob;
  }
}
