package ripsearch.core.walk;

import java.nio.file.Path;
import java.util.function.Supplier;

public interface WalkPlan {
  Path root();

  int threads();

  /**
   * Walks the tree on {@link #threads()} worker threads and returns once all of them finished.
   * {@code visitorFactory} is invoked exactly once per worker.
   */
  void run(Supplier<WalkVisitor> visitorFactory);
}
