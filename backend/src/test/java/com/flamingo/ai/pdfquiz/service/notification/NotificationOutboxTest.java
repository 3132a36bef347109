package com.flamingo.ai.pdfquiz.service.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.entity.Notification;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.domain.enums.NotificationStatus;
import com.flamingo.ai.pdfquiz.domain.repository.NotificationRepository;
import com.flamingo.ai.pdfquiz.service.job.IngestResult;
import com.flamingo.ai.pdfquiz.service.job.QuizResult;
import com.flamingo.ai.pdfquiz.service.rag.generation.Difficulty;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizMode;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizQuestion;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizSpec;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationOutbox Tests")
class NotificationOutboxTest {

  private static final Instant NOW = Instant.parse("2026-05-04T10:15:30Z");

  @Mock private NotificationRepository notificationRepository;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private NotificationOutbox outbox;

  @BeforeEach
  void setUp() {
    outbox =
        new NotificationOutbox(
            notificationRepository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    lenient().when(notificationRepository.save(any(Notification.class))).then(returnsFirstArg());
  }

  @Test
  @DisplayName("Should flatten an ingestion result into the upload payload")
  void shouldRecordIngestSuccess() throws Exception {
    Job job = job(JobKind.INGEST, "42");

    Notification notification =
        outbox.recordSuccess(job, IngestResult.success("pdf-1", 42L, 12, "Biology", 30));

    assertThat(notification.getStatus()).isEqualTo(NotificationStatus.PENDING);
    assertThat(notification.isSuccess()).isTrue();
    assertThat(notification.getCorrelationId()).isEqualTo("42");
    JsonNode payload = objectMapper.readTree(notification.getPayload());
    assertThat(payload.get("upload_id").isNumber()).isTrue();
    assertThat(payload.get("upload_id").asLong()).isEqualTo(42L);
    assertThat(payload.get("success").asBoolean()).isTrue();
    assertThat(payload.get("timestamp").asText()).isEqualTo("2026-05-04T10:15:30Z");
    assertThat(payload.get("pdf_id").asText()).isEqualTo("pdf-1");
    assertThat(payload.get("total_pages").asInt()).isEqualTo(12);
    assertThat(payload.get("pdf_name").asText()).isEqualTo("Biology");
    assertThat(payload.get("message").asText()).isEqualTo("PDF processed successfully");
    assertThat(payload.has("chunk_count")).isFalse();
  }

  @Test
  @DisplayName("Should nest a quiz result under result")
  void shouldRecordQuizSuccess() throws Exception {
    Job job = job(JobKind.GENERATE_QUIZ, "7");
    QuizSpec spec =
        new QuizSpec(QuizMode.PAGE_RANGE, List.of("pdf-1"), null, 1, 3, 1, Difficulty.MEDIUM);
    QuizQuestion question =
        new QuizQuestion("Q?", List.of("A) 1", "B) 2", "C) 3", "D) 4"), "A) 1", "because");

    Notification notification =
        outbox.recordSuccess(job, QuizResult.of("quiz-1", spec, List.of(question)));

    JsonNode payload = objectMapper.readTree(notification.getPayload());
    assertThat(payload.get("exam_id").asLong()).isEqualTo(7L);
    assertThat(payload.at("/result/quiz_id").asText()).isEqualTo("quiz-1");
    assertThat(payload.at("/result/questions/0/correct_answer").asText()).isEqualTo("A) 1");
    assertThat(payload.at("/result/metadata/quiz_type").asText()).isEqualTo("page_range");
  }

  @Test
  @DisplayName("Should carry the error of a failed job")
  void shouldRecordFailure() throws Exception {
    Notification notification =
        outbox.recordFailure(job(JobKind.INGEST, "42"), "Downloaded content is not a PDF");

    assertThat(notification.isSuccess()).isFalse();
    JsonNode payload = objectMapper.readTree(notification.getPayload());
    assertThat(payload.get("success").asBoolean()).isFalse();
    assertThat(payload.get("error").asText()).isEqualTo("Downloaded content is not a PDF");
  }

  @Test
  @DisplayName("Should send non-numeric correlation ids as text")
  void shouldKeepNonNumericCorrelationAsText() {
    assertThat(NotificationOutbox.correlationValue("123")).isEqualTo(123L);
    assertThat(NotificationOutbox.correlationValue("abc-1")).isEqualTo("abc-1");
    assertThat(NotificationOutbox.correlationValue("99999999999999999999"))
        .isEqualTo("99999999999999999999");
  }

  private static Job job(JobKind kind, String correlationId) {
    return Job.builder()
        .id("job-1")
        .kind(kind)
        .correlationId(correlationId)
        .targetId("target")
        .payload("{}")
        .build();
  }
}
