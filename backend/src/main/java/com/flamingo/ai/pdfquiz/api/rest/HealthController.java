package com.flamingo.ai.pdfquiz.api.rest;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.service.job.JobQueueService;
import com.flamingo.ai.pdfquiz.service.job.QueueStats;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

  private final ElasticsearchClient elasticsearchClient;
  private final JobQueueService jobQueueService;

  /** Returns service status, vector store reachability and queue counts. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean elasticsearchUp = pingElasticsearch();
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", elasticsearchUp ? "UP" : "DEGRADED");
    health.put("timestamp", Instant.now());
    health.put("service", "pdf-quiz-rag");
    health.put("elasticsearch", elasticsearchUp ? "operational" : "unreachable");

    Map<String, Object> queues = new LinkedHashMap<>();
    for (Map.Entry<JobKind, QueueStats> entry : jobQueueService.info().entrySet()) {
      queues.put(entry.getValue().name(), entry.getValue());
    }
    health.put("queues", queues);
    return ResponseEntity.ok(health);
  }

  private boolean pingElasticsearch() {
    try {
      return elasticsearchClient.ping().value();
    } catch (Exception e) {
      log.warn("Elasticsearch ping failed: {}", e.getMessage());
      return false;
    }
  }
}
