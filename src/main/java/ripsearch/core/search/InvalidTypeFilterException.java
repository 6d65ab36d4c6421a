package ripsearch.core.search;

public class InvalidTypeFilterException extends SearchConfigurationException {
  public InvalidTypeFilterException(String typeName) {
    super("unrecognized file type: " + typeName);
  }
}
