package ripsearch.core.walk;

import java.nio.file.Path;

public record WalkEntry(Path path, int depth, boolean directory, long size) {
  public boolean isFile() {
    return !directory;
  }
}
