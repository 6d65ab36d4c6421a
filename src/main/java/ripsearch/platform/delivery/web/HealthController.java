package ripsearch.platform.delivery.web;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import ripsearch.core.search.SearchOptions;

@RestController
public class HealthController {
  private final int defaultThreads;

  public HealthController(@Value("${ripsearch.search.threads:0}") int configuredThreads) {
    SearchOptions options = SearchOptions.builder().threads(Math.max(0, configuredThreads)).build();
    this.defaultThreads = options.resolvedThreads();
  }

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "ok", "defaultThreads", defaultThreads));
  }
}
