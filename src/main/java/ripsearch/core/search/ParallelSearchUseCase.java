package ripsearch.core.search;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ripsearch.core.walk.DirectoryWalkerPort;
import ripsearch.core.walk.WalkEntry;
import ripsearch.core.walk.WalkError;
import ripsearch.core.walk.WalkPlan;
import ripsearch.core.walk.WalkState;
import ripsearch.core.walk.WalkVisitor;

public class ParallelSearchUseCase {
  private static final Logger log = LoggerFactory.getLogger(ParallelSearchUseCase.class);

  private final PatternCompilerPort patternCompiler;
  private final DirectoryWalkerPort directoryWalker;
  private final FileSearcherPort fileSearcher;

  public ParallelSearchUseCase(
      PatternCompilerPort patternCompiler,
      DirectoryWalkerPort directoryWalker,
      FileSearcherPort fileSearcher) {
    this.patternCompiler = patternCompiler;
    this.directoryWalker = directoryWalker;
    this.fileSearcher = fileSearcher;
  }

  public SearchResult searchParallel(String pattern, Path root, SearchOptions options) {
    return searchParallel(pattern, root, options, new CancellationToken());
  }

  public SearchResult searchParallel(
      String pattern, Path root, SearchOptions options, CancellationToken cancellation) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(cancellation, "cancellation");

    long startedAt = System.nanoTime();

    PatternMatcher matcher = patternCompiler.compile(pattern, options);
    WalkPlan plan = directoryWalker.build(root, options);
    log.debug("Searching {} for '{}' on {} worker(s)", plan.root(), pattern, plan.threads());

    SearchRun run = new SearchRun(matcher, options, cancellation);
    Thread collectorThread = new Thread(run.collector, "search-result-collector");
    collectorThread.setDaemon(true);
    collectorThread.start();

    try {
      plan.run(run::newWorker);
    } finally {
      run.collector.close();
      try {
        collectorThread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while draining search results.", e);
      }
    }

    List<SearchMatch> matches = run.collector.matches();
    long matchCount = matches.stream().filter(m -> !m.context()).count();
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    SearchStats stats =
        new SearchStats(
            matchCount, run.filesSearched.get(), run.filesMatched.get(), elapsedMillis);

    boolean cancelled = cancellation.isCancelled();
    if (cancelled) {
      log.warn("Search in {} was cancelled after {} ms", plan.root(), elapsedMillis);
    }
    log.debug(
        "Search in {} finished: {} match(es) in {} of {} file(s), {} error(s), {} ms",
        plan.root(),
        stats.matches(),
        stats.filesMatched(),
        stats.filesSearched(),
        run.errors().size(),
        elapsedMillis);

    return new SearchResult(matches, stats, run.errors(), cancelled);
  }

  private final class SearchRun {
    private final PatternMatcher matcher;
    private final SearchOptions options;
    private final CancellationToken cancellation;
    private final FileClassifier classifier;
    private final ResultCollector collector = new ResultCollector();
    private final AtomicLong filesSearched = new AtomicLong();
    private final AtomicLong filesMatched = new AtomicLong();
    private final List<String> errors = new ArrayList<>();

    private SearchRun(
        PatternMatcher matcher, SearchOptions options, CancellationToken cancellation) {
      this.matcher = matcher;
      this.options = options;
      this.cancellation = cancellation;
      this.classifier = new FileClassifier(options);
    }

    private WalkVisitor newWorker() {
      return new SearchWorker(this);
    }

    private void recordError(String error) {
      synchronized (errors) {
        errors.add(error);
      }
    }

    private List<String> errors() {
      synchronized (errors) {
        return List.copyOf(errors);
      }
    }
  }

  private final class SearchWorker implements WalkVisitor {
    private final SearchRun run;

    private SearchWorker(SearchRun run) {
      this.run = run;
    }

    @Override
    public WalkState visit(WalkEntry entry) {
      if (run.cancellation.isCancelled()) {
        return WalkState.QUIT;
      }
      if (!entry.isFile() || !run.classifier.accept(entry)) {
        return WalkState.CONTINUE;
      }

      Path path = entry.path();

      run.filesSearched.incrementAndGet();
      try {
        List<SearchMatch> found = fileSearcher.search(run.matcher, path, run.options);
        if (found.stream().anyMatch(m -> !m.context())) {
          run.filesMatched.incrementAndGet();
          run.collector.submit(new FileBatch(path, found));
        }
      } catch (BinaryFileException e) {
        log.trace("Skipping binary file {}", e.path());
      } catch (CharacterCodingException e) {
        log.trace("Skipping {}: {}", path, e.getMessage());
      } catch (IOException e) {
        String error = path + ": " + IoErrorMessages.describe(e);
        log.warn("Failed to search {}", error);
        run.recordError(error);
      } catch (RuntimeException e) {
        String error = path + ": " + e;
        log.warn("Stopping search after unexpected failure on {}", path, e);
        run.recordError(error);
        run.cancellation.cancel();
        return WalkState.QUIT;
      }
      return WalkState.CONTINUE;
    }

    @Override
    public WalkState visitError(WalkError error) {
      if (run.cancellation.isCancelled()) {
        return WalkState.QUIT;
      }
      log.warn("Failed to enumerate {}", error);
      run.recordError(error.toString());
      return WalkState.CONTINUE;
    }
  }
}
