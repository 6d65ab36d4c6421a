package ripsearch.platform.search;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ripsearch.core.search.CancellationToken;
import ripsearch.core.search.ParallelSearchUseCase;
import ripsearch.core.search.SearchOptions;
import ripsearch.core.search.SearchResult;
import ripsearch.core.search.SearchStats;

@ExtendWith(MockitoExtension.class)
class DeadlineSearchServiceTest {
  private static final Path ROOT = Path.of("root");

  @Mock private ParallelSearchUseCase parallelSearchUseCase;

  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void search_cancelsTokenWhenTimeoutElapses() {
    stubSearchWaitingForCancellation();
    DeadlineSearchService service =
        new DeadlineSearchService(parallelSearchUseCase, scheduler, Duration.ofMillis(50));

    SearchResult result = service.search("foo", ROOT, SearchOptions.defaults());

    assertTrue(result.cancelled());
  }

  @Test
  void search_zeroTimeoutNeverCancels() {
    when(parallelSearchUseCase.searchParallel(eq("foo"), eq(ROOT), any(), any()))
        .thenAnswer(
            invocation -> {
              CancellationToken cancellation = invocation.getArgument(3);
              return new SearchResult(
                  List.of(), SearchStats.empty(), List.of(), cancellation.isCancelled());
            });
    DeadlineSearchService service =
        new DeadlineSearchService(parallelSearchUseCase, scheduler, Duration.ZERO);

    SearchResult result = service.search("foo", ROOT, SearchOptions.defaults());

    assertFalse(result.cancelled());
  }

  private void stubSearchWaitingForCancellation() {
    when(parallelSearchUseCase.searchParallel(eq("foo"), eq(ROOT), any(), any()))
        .thenAnswer(
            invocation -> {
              CancellationToken cancellation = invocation.getArgument(3);
              long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
              while (!cancellation.isCancelled() && System.nanoTime() < deadline) {
                Thread.sleep(10);
              }
              return new SearchResult(
                  List.of(), SearchStats.empty(), List.of(), cancellation.isCancelled());
            });
  }
}
