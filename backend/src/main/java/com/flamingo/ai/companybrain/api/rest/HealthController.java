package com.flamingo.ai.companybrain.api.rest;

import com.flamingo.ai.companybrain.elasticsearch.DocumentIndexOperations;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final DocumentIndexOperations documentIndex;

  /** Reports whether the document index is reachable. Always 200; status is DEGRADED when not. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean indexUp = documentIndex.healthCheck();
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", indexUp ? "UP" : "DEGRADED");
    health.put("elasticsearch", indexUp ? "UP" : "DOWN");
    health.put("index", documentIndex.getIndexName());
    health.put("timestamp", Instant.now());
    return ResponseEntity.ok(health);
  }
}
