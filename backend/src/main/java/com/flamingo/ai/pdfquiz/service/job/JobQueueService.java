package com.flamingo.ai.pdfquiz.service.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.JobStatus;
import com.flamingo.ai.pdfquiz.domain.repository.JobRepository;
import com.flamingo.ai.pdfquiz.exception.JobNotFoundException;
import com.flamingo.ai.pdfquiz.service.notification.NotificationOutbox;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable job queue backed by the {@code jobs} table.
 *
 * <p>Jobs move {@code QUEUED -> STARTED -> FINISHED | FAILED}, or {@code QUEUED -> CANCELED}. Every
 * transition is a conditional update on the current status, so of two callers racing for the same
 * job (claim and cancel, or the worker and the stuck-job reaper) exactly one wins. Terminal
 * transitions write the job and its notification in one transaction, and only for the winner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobQueueService {

  private final JobRepository jobRepository;
  private final NotificationOutbox notificationOutbox;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /** Queues a PDF ingestion. */
  @Transactional
  public Job enqueueIngest(IngestRequest request) {
    return enqueue(
        JobKind.INGEST, String.valueOf(request.uploadId()), request.pdfId(), request);
  }

  /** Queues a quiz generation. */
  @Transactional
  public Job enqueueQuiz(QuizJobRequest request) {
    return enqueue(
        JobKind.GENERATE_QUIZ, String.valueOf(request.examId()), request.quizId(), request);
  }

  private Job enqueue(JobKind kind, String correlationId, String targetId, Object payload) {
    Job job =
        Job.builder()
            .id(UUID.randomUUID().toString())
            .kind(kind)
            .status(JobStatus.QUEUED)
            .correlationId(correlationId)
            .targetId(targetId)
            .payload(toJson(payload))
            .createdAt(Instant.now())
            .build();
    Job saved = jobRepository.save(job);
    log.info(
        "Enqueued {} job {} (correlation {}, target {})",
        kind.getQueueName(),
        saved.getId(),
        correlationId,
        targetId);
    return saved;
  }

  /**
   * Returns the full job record.
   *
   * @throws JobNotFoundException if no job has this id
   */
  @Transactional(readOnly = true)
  public Job status(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /**
   * Cancels a job that has not started yet.
   *
   * @return {@code true} if the job was queued and is now canceled; {@code false} for unknown jobs
   *     and jobs past the queue, which are left untouched
   */
  @Transactional
  public boolean cancel(String jobId) {
    boolean cancelled = jobRepository.cancelIfQueued(jobId, Instant.now()) == 1;
    if (cancelled) {
      log.info("Cancelled job {}", jobId);
      meterRegistry.counter("jobs.cancelled").increment();
    } else {
      log.warn("Cannot cancel job {}: not queued", jobId);
    }
    return cancelled;
  }

  /** Counts per queue. */
  @Transactional(readOnly = true)
  public Map<JobKind, QueueStats> info() {
    Map<JobKind, QueueStats> stats = new EnumMap<>(JobKind.class);
    for (JobKind kind : JobKind.values()) {
      stats.put(
          kind,
          new QueueStats(
              kind.getQueueName(),
              jobRepository.countByKindAndStatus(kind, JobStatus.QUEUED),
              jobRepository.countByKindAndStatus(kind, JobStatus.STARTED),
              jobRepository.countByKindAndStatus(kind, JobStatus.FINISHED),
              jobRepository.countByKindAndStatus(kind, JobStatus.FAILED),
              jobRepository.countByKindAndStatus(kind, JobStatus.CANCELED)));
    }
    return stats;
  }

  /** Oldest queued jobs of a kind. */
  @Transactional(readOnly = true)
  public List<Job> nextQueued(JobKind kind, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return jobRepository.findByKindAndStatusOrderByCreatedAtAsc(
        kind, JobStatus.QUEUED, PageRequest.of(0, limit));
  }

  /**
   * Moves a queued job to STARTED.
   *
   * @return whether this caller won the job
   */
  @Transactional
  public boolean claim(String jobId) {
    return jobRepository.claim(jobId, Instant.now()) == 1;
  }

  /**
   * Marks a started job as finished and records its success notification.
   *
   * @return {@code false} if the job was no longer running, e.g. already failed by the reaper
   */
  @Transactional
  public boolean complete(String jobId, Object result) {
    if (jobRepository.finishIfStarted(jobId, toJson(result), Instant.now()) != 1) {
      log.warn("Not completing job {}: it is no longer running", jobId);
      return false;
    }
    Job job = status(jobId);
    notificationOutbox.recordSuccess(job, result);
    record(job);
    log.info("Job {} ({}) finished", jobId, job.getKind().getQueueName());
    return true;
  }

  /**
   * Marks a started job as failed and records its failure notification.
   *
   * @return {@code false} if the job was no longer running
   */
  @Transactional
  public boolean fail(String jobId, String error) {
    if (jobRepository.failIfStarted(jobId, error, Instant.now()) != 1) {
      log.warn("Not failing job {}: it is no longer running", jobId);
      return false;
    }
    Job job = status(jobId);
    notificationOutbox.recordFailure(job, error);
    record(job);
    log.info("Job {} ({}) failed: {}", jobId, job.getKind().getQueueName(), error);
    return true;
  }

  /** Decodes a job's payload. */
  public <T> T payload(Job job, Class<T> type) {
    try {
      return objectMapper.readValue(job.getPayload(), type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unreadable payload for job " + job.getId(), e);
    }
  }

  private void record(Job job) {
    meterRegistry
        .counter(
            "jobs.completed",
            "kind",
            job.getKind().getQueueName(),
            "status",
            job.getStatus().getValue())
        .increment();
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize job data", e);
    }
  }
}
