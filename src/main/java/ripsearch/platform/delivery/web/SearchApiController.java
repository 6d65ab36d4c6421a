package ripsearch.platform.delivery.web;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RestController;
import ripsearch.core.search.SearchConfigurationException;
import ripsearch.core.search.SearchOptions;
import ripsearch.core.search.SearchReportFormatter;
import ripsearch.core.search.SearchResult;
import ripsearch.platform.search.DeadlineSearchService;

@RestController
public class SearchApiController {
  private static final String MISSING_PATTERN = "Missing required query parameter: pattern";

  private final DeadlineSearchService searchService;
  private final String defaultRoot;
  private final Path baseRoot;
  private final int defaultThreads;

  public SearchApiController(
      DeadlineSearchService searchService,
      @Value("${ripsearch.search.default-root:.}") String defaultRoot,
      @Value("${ripsearch.search.threads:0}") int defaultThreads) {
    this.searchService = searchService;
    this.defaultRoot = defaultRoot;
    this.baseRoot = Path.of(defaultRoot).toAbsolutePath().normalize();
    this.defaultThreads = defaultThreads;
  }

  @GetMapping(path = "/api/search/text", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TextSearchResponse> searchText(@ModelAttribute SearchQueryForm form) {
    String pattern = form.getPattern();
    String root = resolveRoot(form);
    if (pattern == null || pattern.isEmpty()) {
      return ResponseEntity.badRequest()
          .body(TextSearchResponse.failed(pattern, root, MISSING_PATTERN));
    }

    try {
      SearchResult result = run(form, root);
      return ResponseEntity.ok(TextSearchResponse.of(pattern, root, result));
    } catch (SearchConfigurationException | IllegalArgumentException e) {
      return ResponseEntity.badRequest()
          .body(TextSearchResponse.failed(pattern, root, e.getMessage()));
    }
  }

  @GetMapping(path = "/api/search/report", produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> searchReport(@ModelAttribute SearchQueryForm form) {
    String pattern = form.getPattern();
    if (pattern == null || pattern.isEmpty()) {
      return ResponseEntity.badRequest().body(MISSING_PATTERN + "\n");
    }

    try {
      SearchResult result = run(form, resolveRoot(form));
      return ResponseEntity.ok(SearchReportFormatter.format(result));
    } catch (SearchConfigurationException | IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(e.getMessage() + "\n");
    }
  }

  private SearchResult run(SearchQueryForm form, String root) {
    SearchOptions options = form.toOptions(defaultThreads);
    return searchService.search(form.getPattern(), confine(root), options);
  }

  /** Resolves a requested root against the default root; it must not escape it. */
  private Path confine(String root) {
    Path requested = baseRoot.resolve(root).normalize();
    if (!requested.startsWith(baseRoot)) {
      throw new IllegalArgumentException("Search root must be under " + baseRoot + ".");
    }
    if (Files.exists(requested)) {
      try {
        if (!requested.toRealPath().startsWith(baseRoot.toRealPath())) {
          throw new IllegalArgumentException("Search root must be under " + baseRoot + ".");
        }
      } catch (IOException e) {
        throw new IllegalArgumentException("Cannot resolve search root " + requested + ".", e);
      }
    }
    return requested;
  }

  private String resolveRoot(SearchQueryForm form) {
    String root = form.getRoot();
    return root == null || root.isBlank() ? defaultRoot : root.trim();
  }
}
