package ripsearch.platform.config;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ripsearch.core.search.FileSearcherPort;
import ripsearch.core.search.ParallelSearchUseCase;
import ripsearch.core.search.PatternCompilerPort;
import ripsearch.core.walk.DirectoryWalkerPort;

@Configuration
public class SearchConfig {
  @Bean
  public ParallelSearchUseCase parallelSearchUseCase(
      PatternCompilerPort patternCompiler,
      DirectoryWalkerPort directoryWalker,
      FileSearcherPort fileSearcher) {
    return new ParallelSearchUseCase(patternCompiler, directoryWalker, fileSearcher);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService searchDeadlineScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "search-deadline");
          thread.setDaemon(true);
          return thread;
        });
  }
}
