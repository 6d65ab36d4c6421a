package ripsearch.core.search;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal shared by every worker of one search run.
 *
 * <p>Workers poll it once per walked entry, so a cancelled run finishes the file scans already
 * in flight and dispatches nothing new.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
