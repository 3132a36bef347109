package com.flamingo.ai.pdfquiz.config;

import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.JobStatus;
import com.flamingo.ai.pdfquiz.domain.repository.JobRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Registers a queued-job depth gauge per job kind. */
  @Bean
  public InitializingBean queueDepthGauges(MeterRegistry registry, JobRepository jobRepository) {
    return () -> {
      for (JobKind kind : JobKind.values()) {
        Gauge.builder(
                "jobs.queue.depth",
                jobRepository,
                repo -> repo.countByKindAndStatus(kind, JobStatus.QUEUED))
            .tag("kind", kind.getQueueName())
            .description("Jobs waiting to be claimed")
            .register(registry);
      }
    };
  }
}
