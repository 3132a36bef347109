package com.flamingo.ai.pdfquiz.service.notification;

import com.flamingo.ai.pdfquiz.config.JobConfig;
import com.flamingo.ai.pdfquiz.domain.entity.Notification;
import com.flamingo.ai.pdfquiz.domain.enums.NotificationStatus;
import com.flamingo.ai.pdfquiz.domain.repository.NotificationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Drains pending outbox notifications through the webhook notifier.
 *
 * <p>The scheduled pass only hands notifications to the webhook pool and returns, so slow or
 * unreachable endpoints never hold a scheduler thread. A notification stays PENDING until its
 * delivery finishes and is not handed out again while one is in progress.
 */
@Component
@Slf4j
public class NotificationDispatcher {

  private final NotificationRepository notificationRepository;
  private final WebhookNotifier webhookNotifier;
  private final JobConfig jobConfig;
  private final MeterRegistry meterRegistry;
  private final ThreadPoolTaskExecutor webhookExecutor;
  private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

  public NotificationDispatcher(
      NotificationRepository notificationRepository,
      WebhookNotifier webhookNotifier,
      JobConfig jobConfig,
      MeterRegistry meterRegistry,
      @Qualifier("webhookExecutor") ThreadPoolTaskExecutor webhookExecutor) {
    this.notificationRepository = notificationRepository;
    this.webhookNotifier = webhookNotifier;
    this.jobConfig = jobConfig;
    this.meterRegistry = meterRegistry;
    this.webhookExecutor = webhookExecutor;
  }

  @Scheduled(fixedDelayString = "${jobs.webhook.dispatch-interval-ms:2000}")
  public void dispatchPending() {
    try {
      dispatch();
    } catch (Exception e) {
      log.error("Error during scheduled webhook dispatch", e);
    }
  }

  /**
   * Hands one batch of pending notifications, oldest first, to the webhook pool.
   *
   * @return number of deliveries started
   */
  int dispatch() {
    List<Notification> pending =
        notificationRepository.findByStatusOrderByIdAsc(
            NotificationStatus.PENDING,
            PageRequest.of(0, jobConfig.getWebhook().getDispatchBatchSize()));
    int started = 0;
    for (Notification notification : pending) {
      if (!inFlight.add(notification.getId())) {
        continue;
      }
      try {
        webhookExecutor.execute(() -> deliver(notification));
        started++;
      } catch (TaskRejectedException e) {
        inFlight.remove(notification.getId());
        log.debug("Webhook pool is busy, notification {} stays pending", notification.getId());
        break;
      }
    }
    return started;
  }

  void deliver(Notification notification) {
    try {
      DeliveryResult result = webhookNotifier.deliver(notification);
      if (result.delivered()) {
        notification.markDelivered(result.attempts());
        meterRegistry.counter("webhook.delivery", "outcome", "delivered").increment();
      } else {
        notification.markDropped(result.attempts(), result.error());
        meterRegistry.counter("webhook.delivery", "outcome", "dropped").increment();
        log.warn(
            "Dropped notification {} for job {} after {} attempts",
            notification.getId(),
            notification.getJobId(),
            result.attempts());
      }
      notificationRepository.save(notification);
    } catch (Exception e) {
      // the row is still PENDING, so the next pass delivers it again
      log.error("Could not record delivery of notification {}", notification.getId(), e);
    } finally {
      inFlight.remove(notification.getId());
    }
  }
}
