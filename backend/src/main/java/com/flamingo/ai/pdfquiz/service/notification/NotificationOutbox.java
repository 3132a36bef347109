package com.flamingo.ai.pdfquiz.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.entity.Notification;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.repository.NotificationRepository;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes completion events for finished and failed jobs.
 *
 * <p>Events are stored in the caller's transaction so a job's terminal state and its event commit
 * together. Delivery happens later in {@link NotificationDispatcher}.
 */
@Component
@Slf4j
public class NotificationOutbox {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final NotificationRepository notificationRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public NotificationOutbox(
      NotificationRepository notificationRepository, ObjectMapper objectMapper) {
    this(notificationRepository, objectMapper, Clock.systemUTC());
  }

  NotificationOutbox(
      NotificationRepository notificationRepository, ObjectMapper objectMapper, Clock clock) {
    this.notificationRepository = notificationRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Records a success event built from the job's result. */
  @Transactional(propagation = Propagation.MANDATORY)
  public Notification recordSuccess(Job job, Object result) {
    Map<String, Object> payload = header(job, true);
    Map<String, Object> fields = objectMapper.convertValue(result, MAP_TYPE);
    if (job.getKind() == JobKind.INGEST) {
      payload.put("pdf_id", fields.get("pdf_id"));
      payload.put("total_pages", fields.get("total_pages"));
      payload.put("pdf_name", fields.get("pdf_name"));
      payload.put("message", fields.get("message"));
    } else {
      payload.put("result", fields);
    }
    return save(job, true, payload);
  }

  /** Records a failure event carrying the error message. */
  @Transactional(propagation = Propagation.MANDATORY)
  public Notification recordFailure(Job job, String error) {
    Map<String, Object> payload = header(job, false);
    payload.put("error", error);
    return save(job, false, payload);
  }

  private Map<String, Object> header(Job job, boolean success) {
    Map<String, Object> payload = new LinkedHashMap<>();
    String idField = job.getKind() == JobKind.INGEST ? "upload_id" : "exam_id";
    payload.put(idField, correlationValue(job.getCorrelationId()));
    payload.put("success", success);
    payload.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
    return payload;
  }

  private Notification save(Job job, boolean success, Map<String, Object> payload) {
    String json;
    try {
      json = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize notification for job " + job.getId(), e);
    }
    Notification notification =
        Notification.builder()
            .jobId(job.getId())
            .jobKind(job.getKind())
            .correlationId(job.getCorrelationId())
            .success(success)
            .payload(json)
            .build();
    Notification saved = notificationRepository.save(notification);
    log.debug(
        "Queued {} notification for job {} ({})",
        success ? "success" : "failure",
        job.getId(),
        job.getKind());
    return saved;
  }

  /** Numeric ids are sent as numbers, anything else as text. */
  static Object correlationValue(String correlationId) {
    if (correlationId != null
        && !correlationId.isEmpty()
        && correlationId.chars().allMatch(Character::isDigit)) {
      try {
        return Long.parseLong(correlationId);
      } catch (NumberFormatException e) {
        return correlationId;
      }
    }
    return correlationId;
  }
}
