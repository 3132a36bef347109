package com.flamingo.ai.pdfquiz.domain.entity;

import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.JobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A unit of deferred work: one PDF ingestion or one quiz generation. */
@Entity
@Table(
    name = "jobs",
    indexes = {@Index(name = "idx_jobs_kind_status", columnList = "kind,status,createdAt")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

  @Id private String id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private JobKind kind;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.QUEUED;

  /** Caller's handle: the upload id for ingestion, the exam id for quizzes. */
  @Column(nullable = false)
  private String correlationId;

  /** Id assigned at enqueue time: the pdf id for ingestion, the quiz id for quizzes. */
  @Column(nullable = false)
  private String targetId;

  /** Request as JSON. */
  @Column(nullable = false, columnDefinition = "TEXT")
  private String payload;

  /** Result as JSON, set when the job finishes. */
  @Column(columnDefinition = "TEXT")
  private String result;

  /** Error message, set when the job fails. */
  @Column(columnDefinition = "TEXT")
  private String error;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant startedAt;

  private Instant endedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
