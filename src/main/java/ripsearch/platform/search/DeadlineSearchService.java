package ripsearch.platform.search;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ripsearch.core.search.CancellationToken;
import ripsearch.core.search.ParallelSearchUseCase;
import ripsearch.core.search.SearchOptions;
import ripsearch.core.search.SearchResult;

@Component
public class DeadlineSearchService {
  private static final Logger log = LoggerFactory.getLogger(DeadlineSearchService.class);

  private final ParallelSearchUseCase parallelSearchUseCase;
  private final ScheduledExecutorService scheduler;
  private final Duration timeout;

  public DeadlineSearchService(
      ParallelSearchUseCase parallelSearchUseCase,
      @Qualifier("searchDeadlineScheduler") ScheduledExecutorService scheduler,
      @Value("${ripsearch.search.timeout:30s}") Duration timeout) {
    this.parallelSearchUseCase = parallelSearchUseCase;
    this.scheduler = scheduler;
    this.timeout = timeout;
  }

  public SearchResult search(String pattern, Path root, SearchOptions options) {
    CancellationToken cancellation = new CancellationToken();
    ScheduledFuture<?> deadline = null;
    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      deadline =
          scheduler.schedule(
              () -> {
                log.warn("Search for '{}' in {} exceeded {}, cancelling", pattern, root, timeout);
                cancellation.cancel();
              },
              timeout.toMillis(),
              TimeUnit.MILLISECONDS);
    }

    try {
      return parallelSearchUseCase.searchParallel(pattern, root, options, cancellation);
    } finally {
      if (deadline != null) {
        deadline.cancel(false);
      }
    }
  }
}
