package ripsearch.core.search;

import java.io.IOException;
import java.nio.file.Path;

/** Raised by a file searcher when content turns out to be binary; never reported to callers. */
public class BinaryFileException extends IOException {
  private final Path path;

  public BinaryFileException(Path path) {
    super("binary content detected in " + path);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
