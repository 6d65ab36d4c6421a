package ripsearch.core.walk;

import java.nio.file.Path;

public record WalkError(Path path, int depth, String message) {
  @Override
  public String toString() {
    return path == null ? message : path + ": " + message;
  }
}
