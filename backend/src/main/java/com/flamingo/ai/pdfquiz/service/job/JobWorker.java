package com.flamingo.ai.pdfquiz.service.job;

import com.flamingo.ai.pdfquiz.config.JobConfig;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Pulls queued jobs and runs them on the pool of their kind.
 *
 * <p>Each poll submits at most as many jobs as the pool has idle threads. The job is claimed on
 * the pool thread, so a job that was cancelled or taken by another worker in the meantime is
 * skipped. A job's exception never escapes: it fails the job instead.
 */
@Component
@Slf4j
public class JobWorker {

  private final JobQueueService jobQueueService;
  private final JobConfig jobConfig;
  private final MeterRegistry meterRegistry;
  private final Map<JobKind, JobHandler> handlers = new EnumMap<>(JobKind.class);
  private final Map<JobKind, ThreadPoolTaskExecutor> executors = new EnumMap<>(JobKind.class);

  public JobWorker(
      JobQueueService jobQueueService,
      JobConfig jobConfig,
      MeterRegistry meterRegistry,
      List<JobHandler> jobHandlers,
      @Qualifier("ingestExecutor") ThreadPoolTaskExecutor ingestExecutor,
      @Qualifier("quizExecutor") ThreadPoolTaskExecutor quizExecutor) {
    this.jobQueueService = jobQueueService;
    this.jobConfig = jobConfig;
    this.meterRegistry = meterRegistry;
    for (JobHandler handler : jobHandlers) {
      handlers.put(handler.kind(), handler);
    }
    executors.put(JobKind.INGEST, ingestExecutor);
    executors.put(JobKind.GENERATE_QUIZ, quizExecutor);
  }

  @Scheduled(fixedDelayString = "${jobs.poll-interval-ms:1000}")
  public void pollIngest() {
    poll(JobKind.INGEST);
  }

  @Scheduled(fixedDelayString = "${jobs.poll-interval-ms:1000}")
  public void pollQuiz() {
    poll(JobKind.GENERATE_QUIZ);
  }

  /**
   * Submits queued jobs of one kind.
   *
   * @return number of jobs submitted
   */
  int poll(JobKind kind) {
    try {
      ThreadPoolTaskExecutor executor = executors.get(kind);
      int idle = executor.getMaxPoolSize() - executor.getActiveCount();
      int limit = Math.min(idle, jobConfig.getClaimBatchSize());
      int submitted = 0;
      for (Job job : jobQueueService.nextQueued(kind, limit)) {
        try {
          executor.execute(() -> claimAndRun(job));
          submitted++;
        } catch (TaskRejectedException e) {
          log.debug("{} pool is full, job {} stays queued", kind.getQueueName(), job.getId());
          break;
        }
      }
      return submitted;
    } catch (Exception e) {
      log.error("Error polling {} queue", kind.getQueueName(), e);
      return 0;
    }
  }

  void claimAndRun(Job job) {
    if (!jobQueueService.claim(job.getId())) {
      log.debug("Job {} was taken or cancelled before it started", job.getId());
      return;
    }
    log.info("Started {} job {}", job.getKind().getQueueName(), job.getId());
    run(job);
  }

  void run(Job job) {
    JobHandler handler = handlers.get(job.getKind());
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      if (handler == null) {
        throw new IllegalStateException("No handler for job kind " + job.getKind());
      }
      Object result = handler.handle(job);
      jobQueueService.complete(job.getId(), result);
    } catch (Exception e) {
      log.error("Job {} ({}) failed: {}", job.getId(), job.getKind(), e.getMessage(), e);
      failQuietly(job, errorMessage(e));
    } finally {
      sample.stop(meterRegistry.timer("jobs.duration", "kind", job.getKind().getQueueName()));
    }
  }

  private void failQuietly(Job job, String error) {
    try {
      jobQueueService.fail(job.getId(), error);
    } catch (Exception e) {
      log.error("Could not record failure of job {}", job.getId(), e);
    }
  }

  static String errorMessage(Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
