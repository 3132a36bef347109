package com.flamingo.ai.pdfquiz.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.api.dto.response.JobStatusResponse;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.service.job.JobQueueService;
import com.flamingo.ai.pdfquiz.service.job.QueueStats;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for job status, cancellation and queue counts. */
@RestController
@RequestMapping("/pdf")
@RequiredArgsConstructor
public class JobController {

  private final JobQueueService jobQueueService;
  private final ObjectMapper objectMapper;

  @GetMapping("/job/{jobId}/status")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(
        JobStatusResponse.fromEntity(jobQueueService.status(jobId), objectMapper));
  }

  /** Cancels a job that has not started; started or finished jobs are left alone. */
  @DeleteMapping("/job/{jobId}")
  public ResponseEntity<Map<String, Object>> cancelJob(@PathVariable String jobId) {
    boolean cancelled = jobQueueService.cancel(jobId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("cancelled", cancelled);
    body.put(
        "message",
        cancelled
            ? "Job " + jobId + " cancelled successfully"
            : "Job " + jobId + " could not be cancelled (may already be started or completed)");
    return ResponseEntity.ok(body);
  }

  @GetMapping("/queue/info")
  public ResponseEntity<Map<String, Object>> getQueueInfo() {
    Map<JobKind, QueueStats> stats = jobQueueService.info();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("pdf_queue", stats.get(JobKind.INGEST));
    body.put("quiz_queue", stats.get(JobKind.GENERATE_QUIZ));
    body.put("queue_enabled", true);
    return ResponseEntity.ok(body);
  }
}
