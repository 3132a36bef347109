package com.flamingo.ai.pdfquiz.service.job;

import com.flamingo.ai.pdfquiz.config.JobConfig;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.repository.JobRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Force-fails jobs that have been running longer than the configured ceiling. */
@Component
@RequiredArgsConstructor
@Slf4j
public class StuckJobReaper {

  private final JobRepository jobRepository;
  private final JobQueueService jobQueueService;
  private final JobConfig jobConfig;

  @Scheduled(fixedDelayString = "${jobs.reaper-interval-ms:60000}")
  public void reapStuckJobs() {
    log.debug("Running scheduled check for stuck jobs");
    try {
      reap(Instant.now());
    } catch (Exception e) {
      log.error("Error during scheduled check for stuck jobs", e);
    }
  }

  /**
   * Fails every job started before {@code now} minus the timeout.
   *
   * @return number of jobs failed
   */
  int reap(Instant now) {
    int timeoutMinutes = jobConfig.getTimeoutMinutes();
    Instant cutoff = now.minus(Duration.ofMinutes(timeoutMinutes));
    List<Job> stuck = jobRepository.findStuckJobs(cutoff);
    int failed = 0;
    for (Job job : stuck) {
      String error = "Job exceeded " + timeoutMinutes + " minute timeout";
      if (jobQueueService.fail(job.getId(), error)) {
        log.warn("Force-failed job {} started at {}", job.getId(), job.getStartedAt());
        failed++;
      }
    }
    return failed;
  }
}
