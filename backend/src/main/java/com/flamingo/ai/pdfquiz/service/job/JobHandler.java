package com.flamingo.ai.pdfquiz.service.job;

import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;

/** Executes jobs of one kind. */
public interface JobHandler {

  JobKind kind();

  /**
   * Runs a claimed job.
   *
   * @return the result to store on the job; serialized as JSON
   * @throws RuntimeException any failure, which fails the job with the exception message
   */
  Object handle(Job job);
}
