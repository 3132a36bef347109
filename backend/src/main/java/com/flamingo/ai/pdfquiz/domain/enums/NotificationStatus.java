package com.flamingo.ai.pdfquiz.domain.enums;

/** Delivery state of an outbox notification. */
public enum NotificationStatus {
  PENDING,
  DELIVERED,
  /** Every attempt failed; the event is not retried again. */
  DROPPED
}
