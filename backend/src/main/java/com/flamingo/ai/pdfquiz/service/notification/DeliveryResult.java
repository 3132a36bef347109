package com.flamingo.ai.pdfquiz.service.notification;

/**
 * Outcome of delivering one notification.
 *
 * @param delivered whether an attempt was accepted
 * @param attempts attempts made, including the successful one
 * @param error message of the last failed attempt, {@code null} when delivered
 */
public record DeliveryResult(boolean delivered, int attempts, String error) {

  static DeliveryResult delivered(int attempts) {
    return new DeliveryResult(true, attempts, null);
  }

  static DeliveryResult dropped(int attempts, String error) {
    return new DeliveryResult(false, attempts, error);
  }
}
