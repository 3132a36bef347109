package com.flamingo.ai.pdfquiz.domain.repository;

import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.JobStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Job entities. */
@Repository
public interface JobRepository extends JpaRepository<Job, String> {

  /** Oldest jobs of a kind in a status, for polling. */
  List<Job> findByKindAndStatusOrderByCreatedAtAsc(
      JobKind kind, JobStatus status, Pageable pageable);

  long countByKindAndStatus(JobKind kind, JobStatus status);

  long countByStatus(JobStatus status);

  /**
   * Moves a job from QUEUED to STARTED if nobody else did first.
   *
   * @return 1 if this caller claimed the job, 0 otherwise
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = 'STARTED', j.startedAt = :now "
          + "WHERE j.id = :id AND j.status = 'QUEUED'")
  int claim(@Param("id") String id, @Param("now") Instant now);

  /**
   * Moves a job from QUEUED to CANCELED.
   *
   * @return 1 if the job was still queued, 0 otherwise
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = 'CANCELED', j.endedAt = :now "
          + "WHERE j.id = :id AND j.status = 'QUEUED'")
  int cancelIfQueued(@Param("id") String id, @Param("now") Instant now);

  /**
   * Moves a job from STARTED to FINISHED.
   *
   * @return 1 if the job was still running, 0 if something else ended it first
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = 'FINISHED', j.result = :result, j.endedAt = :now "
          + "WHERE j.id = :id AND j.status = 'STARTED'")
  int finishIfStarted(
      @Param("id") String id, @Param("result") String result, @Param("now") Instant now);

  /**
   * Moves a job from STARTED to FAILED.
   *
   * @return 1 if the job was still running, 0 if something else ended it first
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = 'FAILED', j.error = :error, j.endedAt = :now "
          + "WHERE j.id = :id AND j.status = 'STARTED'")
  int failIfStarted(
      @Param("id") String id, @Param("error") String error, @Param("now") Instant now);

  /** Jobs that have been running for too long. */
  @Query("SELECT j FROM Job j WHERE j.status = 'STARTED' AND j.startedAt < :cutoffTime")
  List<Job> findStuckJobs(@Param("cutoffTime") Instant cutoffTime);
}
