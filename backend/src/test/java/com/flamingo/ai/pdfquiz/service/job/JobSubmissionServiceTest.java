package com.flamingo.ai.pdfquiz.service.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfquiz.api.dto.request.PdfUploadRequest;
import com.flamingo.ai.pdfquiz.api.dto.request.QuizRequest;
import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.elasticsearch.CollectionInfo;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.exception.InvalidRequestException;
import com.flamingo.ai.pdfquiz.service.pdf.PdfService;
import com.flamingo.ai.pdfquiz.service.rag.generation.Difficulty;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizMode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobSubmissionService Tests")
class JobSubmissionServiceTest {

  @Mock private JobQueueService jobQueueService;
  @Mock private PdfService pdfService;

  private JobSubmissionService submissionService;

  @BeforeEach
  void setUp() {
    submissionService = new JobSubmissionService(jobQueueService, pdfService, new RagConfig());
  }

  @Test
  @DisplayName("Should queue an upload under a fresh pdf id")
  void shouldQueueUpload() {
    when(jobQueueService.enqueueIngest(any(IngestRequest.class))).thenReturn(new Job());

    submissionService.submitUpload(
        PdfUploadRequest.builder()
            .sourceUrl("https://files.test/a.pdf")
            .uploadId(42L)
            .pdfName("Biology")
            .build());

    ArgumentCaptor<IngestRequest> request = ArgumentCaptor.forClass(IngestRequest.class);
    verify(jobQueueService).enqueueIngest(request.capture());
    assertThat(request.getValue().uploadId()).isEqualTo(42L);
    assertThat(request.getValue().sourceUrl()).isEqualTo("https://files.test/a.pdf");
    assertThat(request.getValue().pdfId()).isNotBlank();
    assertThat(request.getValue().hasPageRange()).isFalse();
  }

  @Nested
  @DisplayName("Upload page range")
  class UploadPageRange {

    @Test
    @DisplayName("Should carry a page range into the ingest job")
    void shouldQueueUploadWithPageRange() {
      when(jobQueueService.enqueueIngest(any(IngestRequest.class))).thenReturn(new Job());

      submissionService.submitUpload(
          PdfUploadRequest.builder()
              .sourceUrl("https://files.test/a.pdf")
              .uploadId(42L)
              .pageStart(3)
              .pageEnd(7)
              .build());

      ArgumentCaptor<IngestRequest> request = ArgumentCaptor.forClass(IngestRequest.class);
      verify(jobQueueService).enqueueIngest(request.capture());
      assertThat(request.getValue().hasPageRange()).isTrue();
      assertThat(request.getValue().pageStart()).isEqualTo(3);
      assertThat(request.getValue().pageEnd()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should reject a range with only one end")
    void shouldRejectHalfRange() {
      PdfUploadRequest request =
          PdfUploadRequest.builder()
              .sourceUrl("https://files.test/a.pdf")
              .uploadId(42L)
              .pageStart(3)
              .build();

      assertThatThrownBy(() -> submissionService.submitUpload(request))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Page start and end must be given together");
      verifyNoInteractions(jobQueueService);
    }

    @Test
    @DisplayName("Should reject a reversed range")
    void shouldRejectReversedRange() {
      PdfUploadRequest request =
          PdfUploadRequest.builder()
              .sourceUrl("https://files.test/a.pdf")
              .uploadId(42L)
              .pageStart(7)
              .pageEnd(3)
              .build();

      assertThatThrownBy(() -> submissionService.submitUpload(request))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Page start cannot be greater than page end");
      verifyNoInteractions(jobQueueService);
    }
  }

  @Nested
  @DisplayName("Quiz validation")
  class QuizValidation {

    @Test
    @DisplayName("Should apply default question count and difficulty")
    void shouldApplyDefaults() {
      when(jobQueueService.enqueueQuiz(any(QuizJobRequest.class))).thenReturn(new Job());

      submissionService.submitQuiz(
          QuizRequest.builder()
              .quizType(QuizMode.TOPIC)
              .pdfIds(List.of("pdf-1"))
              .topic("genetics")
              .examId(7L)
              .build());

      ArgumentCaptor<QuizJobRequest> request = ArgumentCaptor.forClass(QuizJobRequest.class);
      verify(jobQueueService).enqueueQuiz(request.capture());
      assertThat(request.getValue().examId()).isEqualTo(7L);
      assertThat(request.getValue().quizId()).isNotBlank();
      assertThat(request.getValue().spec().numQuestions()).isEqualTo(5);
      assertThat(request.getValue().spec().difficulty()).isEqualTo(Difficulty.MEDIUM);
      verify(pdfService).requireIndexed(List.of("pdf-1"));
    }

    @Test
    @DisplayName("Should require a topic for topic quizzes")
    void shouldRequireTopic() {
      QuizRequest request =
          QuizRequest.builder()
              .quizType(QuizMode.TOPIC)
              .pdfIds(List.of("pdf-1"))
              .topic("  ")
              .examId(7L)
              .build();

      assertThatThrownBy(() -> submissionService.submitQuiz(request))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Topic is required for topic-based quiz");
      verifyNoInteractions(jobQueueService);
    }

    @Test
    @DisplayName("Should reject an inverted page range")
    void shouldRejectInvertedPageRange() {
      QuizRequest request = pageRange(8, 3);

      assertThatThrownBy(() -> submissionService.submitQuiz(request))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Page start cannot be greater than page end");
    }

    @Test
    @DisplayName("Should reject a page range past the end of the PDF")
    void shouldRejectRangePastDocumentEnd() {
      when(pdfService.getPdfInfo("pdf-1")).thenReturn(new CollectionInfo("pdf-1", 10, "Bio", 4));

      assertThatThrownBy(() -> submissionService.submitQuiz(pageRange(5, 10)))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Page range 5-10 exceeds PDF length (4 pages)");
      verifyNoInteractions(jobQueueService);
    }

    @Test
    @DisplayName("Should cap the number of questions")
    void shouldCapQuestionCount() {
      QuizRequest request =
          QuizRequest.builder()
              .quizType(QuizMode.MULTI_PDF_TOPIC)
              .pdfIds(List.of("a", "b"))
              .topic("ecology")
              .numQuestions(21)
              .examId(7L)
              .build();

      assertThatThrownBy(() -> submissionService.submitQuiz(request))
          .hasMessage("Number of questions must be between 1 and 20");
    }

    @Test
    @DisplayName("Should require an exam id")
    void shouldRequireExamId() {
      QuizRequest request =
          QuizRequest.builder().quizType(QuizMode.TOPIC).pdfIds(List.of("a")).topic("t").build();

      assertThatThrownBy(() -> submissionService.submitQuiz(request))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("exam_id is required for queued quiz generation");
    }

    @Test
    @DisplayName("Should not queue a quiz over an unknown PDF")
    void shouldRejectUnknownPdf() {
      doThrow(new CollectionNotFoundException("pdf-9"))
          .when(pdfService)
          .requireIndexed(List.of("pdf-9"));
      QuizRequest request =
          QuizRequest.builder()
              .quizType(QuizMode.TOPIC)
              .pdfIds(List.of("pdf-9"))
              .topic("t")
              .examId(7L)
              .build();

      assertThatThrownBy(() -> submissionService.submitQuiz(request))
          .isInstanceOf(CollectionNotFoundException.class);
      verifyNoInteractions(jobQueueService);
    }
  }

  private static QuizRequest pageRange(int start, int end) {
    return QuizRequest.builder()
        .quizType(QuizMode.PAGE_RANGE)
        .pdfIds(List.of("pdf-1"))
        .pageStart(start)
        .pageEnd(end)
        .examId(7L)
        .build();
  }
}
