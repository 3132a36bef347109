package com.flamingo.ai.pdfquiz.service.notification;

import com.flamingo.ai.pdfquiz.config.JobConfig;
import com.flamingo.ai.pdfquiz.domain.entity.Notification;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.exception.DeliveryException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Posts notification payloads to the caller's webhook.
 *
 * <p>Each notification gets a bounded number of attempts with exponential backoff between them.
 * Timeouts, connection errors and non-2xx responses all count as failed attempts. After the last
 * failed attempt the notification is reported as dropped; nothing is thrown.
 */
@Component
@Slf4j
public class WebhookNotifier {

  private final WebClient webClient;
  private final JobConfig.Webhook config;
  private final Retry retry;

  public WebhookNotifier(WebClient.Builder webClientBuilder, JobConfig jobConfig) {
    this.config = jobConfig.getWebhook();
    this.webClient = webClientBuilder.baseUrl(config.getBaseUrl()).build();
    this.retry =
        Retry.of(
            "webhook",
            RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(config.getInitialBackoffMs()),
                        config.getBackoffMultiplier()))
                .retryExceptions(DeliveryException.class)
                .build());
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Webhook attempt {} failed, retrying in {} ms: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() == null
                        ? "unknown error"
                        : event.getLastThrowable().getMessage()));
    log.info(
        "Webhook notifier initialized: baseUrl={}, maxAttempts={}",
        config.getBaseUrl(),
        config.getMaxAttempts());
  }

  /** Delivers one notification, retrying failed attempts. */
  public DeliveryResult deliver(Notification notification) {
    String path = pathFor(notification.getJobKind());
    AtomicInteger attempts = new AtomicInteger();
    try {
      Retry.decorateRunnable(
              retry,
              () -> {
                attempts.incrementAndGet();
                post(path, notification.getCorrelationId(), notification.getPayload());
              })
          .run();
      log.info(
          "Sent webhook for {} {} after {} attempt(s)",
          notification.getJobKind() == JobKind.INGEST ? "upload" : "exam",
          notification.getCorrelationId(),
          attempts.get());
      return DeliveryResult.delivered(attempts.get());
    } catch (DeliveryException e) {
      log.error(
          "Failed to send webhook after {} attempts for {}: {}",
          attempts.get(),
          notification.getCorrelationId(),
          e.getMessage());
      return DeliveryResult.dropped(attempts.get(), e.getMessage());
    }
  }

  private void post(String path, String correlationId, String payload) {
    try {
      webClient
          .post()
          .uri(path, correlationId)
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(payload)
          .retrieve()
          // redirects and informational replies count as failures too, not only 4xx and 5xx
          .onStatus(status -> !status.is2xxSuccessful(), WebhookNotifier::rejected)
          .toBodilessEntity()
          .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
          .block();
    } catch (DeliveryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DeliveryException("Webhook request failed: " + describe(e), e);
    }
  }

  private static Mono<Throwable> rejected(ClientResponse response) {
    int status = response.statusCode().value();
    return response
        .releaseBody()
        .then(Mono.error(new DeliveryException("Webhook returned status " + status, status)));
  }

  private String pathFor(JobKind kind) {
    return kind == JobKind.INGEST ? config.getUploadPath() : config.getQuizPath();
  }

  private static String describe(Throwable e) {
    Throwable cause = e.getCause() != null ? e.getCause() : e;
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }

  @VisibleForTesting
  Retry retry() {
    return retry;
  }
}
