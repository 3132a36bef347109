package com.flamingo.ai.pdfquiz.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.JobStatus;
import com.flamingo.ai.pdfquiz.exception.GlobalExceptionHandler;
import com.flamingo.ai.pdfquiz.exception.JobNotFoundException;
import com.flamingo.ai.pdfquiz.service.job.JobQueueService;
import com.flamingo.ai.pdfquiz.service.job.QueueStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobController Tests")
class JobControllerTest {

  @Mock private JobQueueService jobQueueService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new JobController(jobQueueService, new ObjectMapper()))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should expose a finished job with its result and ids")
  void shouldReturnFinishedJob() throws Exception {
    Job job =
        Job.builder()
            .id("job-1")
            .kind(JobKind.INGEST)
            .status(JobStatus.FINISHED)
            .correlationId("42")
            .targetId("pdf-1")
            .payload("{}")
            .result("{\"pdf_id\":\"pdf-1\",\"total_pages\":3}")
            .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
            .build();
    when(jobQueueService.status("job-1")).thenReturn(job);

    mockMvc
        .perform(get("/pdf/job/job-1/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job_id").value("job-1"))
        .andExpect(jsonPath("$.queue").value("pdf_processing"))
        .andExpect(jsonPath("$.status").value("finished"))
        .andExpect(jsonPath("$.result.total_pages").value(3))
        .andExpect(jsonPath("$.meta.pdf_id").value("pdf-1"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown job")
  void shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobQueueService.status("nope")).thenThrow(new JobNotFoundException("nope"));

    mockMvc
        .perform(get("/pdf/job/nope/status"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("JOB_001"));
  }

  @Test
  @DisplayName("Should report whether a cancel took effect")
  void shouldReportCancelOutcome() throws Exception {
    when(jobQueueService.cancel("queued")).thenReturn(true);
    when(jobQueueService.cancel("running")).thenReturn(false);

    mockMvc
        .perform(delete("/pdf/job/queued"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true));
    mockMvc
        .perform(delete("/pdf/job/running"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(false));
  }

  @Test
  @DisplayName("Should report both queues")
  void shouldReportQueues() throws Exception {
    Map<JobKind, QueueStats> stats = new EnumMap<>(JobKind.class);
    stats.put(JobKind.INGEST, new QueueStats("pdf_processing", 2, 1, 5, 0, 0));
    stats.put(JobKind.GENERATE_QUIZ, new QueueStats("quiz_processing", 0, 0, 1, 1, 1));
    when(jobQueueService.info()).thenReturn(stats);

    mockMvc
        .perform(get("/pdf/queue/info"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pdf_queue.length").value(2))
        .andExpect(jsonPath("$.quiz_queue.failed").value(1))
        .andExpect(jsonPath("$.queue_enabled").value(true));
  }
}
