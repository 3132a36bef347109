package com.flamingo.ai.pdfquiz.domain.entity;

import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.NotificationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Completion event waiting to be delivered to the caller's webhook. */
@Entity
@Table(name = "notifications")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String jobId;

  /** Kind of the job that produced the event; selects the webhook path. */
  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private JobKind jobKind;

  /** Id placed in the webhook path: upload id or exam id. */
  @Column(nullable = false)
  private String correlationId;

  @Column(nullable = false)
  private boolean success;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String payload;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private NotificationStatus status = NotificationStatus.PENDING;

  @Builder.Default private int attempts = 0;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant deliveredAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public void markDelivered(int attemptCount) {
    this.status = NotificationStatus.DELIVERED;
    this.attempts = attemptCount;
    this.deliveredAt = Instant.now();
  }

  public void markDropped(int attemptCount, String errorMessage) {
    this.status = NotificationStatus.DROPPED;
    this.attempts = attemptCount;
    this.lastError = errorMessage;
  }
}
