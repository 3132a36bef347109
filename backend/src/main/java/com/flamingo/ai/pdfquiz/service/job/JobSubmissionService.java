package com.flamingo.ai.pdfquiz.service.job;

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
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizSpec;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates caller requests and turns them into queued jobs.
 *
 * <p>Nothing is executed here; ids for the future PDF or quiz are assigned up front so the caller
 * can correlate the webhook.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobSubmissionService {

  private final JobQueueService jobQueueService;
  private final PdfService pdfService;
  private final RagConfig ragConfig;

  /**
   * Queues a PDF for ingestion under a fresh pdf id.
   *
   * @throws InvalidRequestException if only one end of a page range is given, or it is malformed
   */
  public Job submitUpload(PdfUploadRequest request) {
    Integer start = request.getPageStart();
    Integer end = request.getPageEnd();
    if ((start == null) != (end == null)) {
      throw new InvalidRequestException("Page start and end must be given together");
    }
    if (start != null) {
      checkPageBounds(start, end);
    }
    String pdfId = UUID.randomUUID().toString();
    log.info("Queueing PDF upload with ID {} for upload {}", pdfId, request.getUploadId());
    return jobQueueService.enqueueIngest(
        new IngestRequest(
            request.getSourceUrl(),
            request.getUploadId(),
            request.getPdfName(),
            pdfId,
            start,
            end));
  }

  /**
   * Validates and queues a quiz under a fresh quiz id.
   *
   * @throws InvalidRequestException if the request breaks a rule of its quiz type
   * @throws CollectionNotFoundException if a referenced PDF is not indexed
   */
  public Job submitQuiz(QuizRequest request) {
    QuizSpec spec = toSpec(request);
    pdfService.requireIndexed(spec.documentIds());
    if (spec.mode() == QuizMode.PAGE_RANGE) {
      checkPageRangeFits(spec);
    }
    String quizId = UUID.randomUUID().toString();
    log.info("Queueing quiz generation with ID {} for exam {}", quizId, request.getExamId());
    return jobQueueService.enqueueQuiz(new QuizJobRequest(quizId, request.getExamId(), spec));
  }

  QuizSpec toSpec(QuizRequest request) {
    List<String> pdfIds = request.getPdfIds();
    if (pdfIds == null || pdfIds.isEmpty()) {
      throw new InvalidRequestException("At least one PDF ID is required");
    }
    if (request.getExamId() == null) {
      throw new InvalidRequestException("exam_id is required for queued quiz generation");
    }
    QuizMode mode = request.getQuizType();
    if (mode == null) {
      throw new InvalidRequestException("Quiz type is required");
    }
    boolean blankTopic = request.getTopic() == null || request.getTopic().isBlank();
    if (mode == QuizMode.TOPIC && blankTopic) {
      throw new InvalidRequestException("Topic is required for topic-based quiz");
    }
    if (mode == QuizMode.MULTI_PDF_TOPIC && blankTopic) {
      throw new InvalidRequestException("Topic is required for multi-PDF topic quiz");
    }
    if (mode == QuizMode.PAGE_RANGE) {
      Integer start = request.getPageStart();
      Integer end = request.getPageEnd();
      if (start == null || end == null) {
        throw new InvalidRequestException("Page start and end are required for page range quiz");
      }
      checkPageBounds(start, end);
    }

    RagConfig.Quiz quiz = ragConfig.getQuiz();
    int numQuestions =
        request.getNumQuestions() == null ? quiz.getDefaultQuestions() : request.getNumQuestions();
    if (numQuestions < 1 || numQuestions > quiz.getMaxQuestions()) {
      throw new InvalidRequestException(
          "Number of questions must be between 1 and " + quiz.getMaxQuestions());
    }
    Difficulty difficulty =
        request.getDifficulty() == null ? Difficulty.MEDIUM : request.getDifficulty();

    return new QuizSpec(
        mode,
        pdfIds,
        request.getTopic(),
        request.getPageStart(),
        request.getPageEnd(),
        numQuestions,
        difficulty);
  }

  private static void checkPageBounds(int start, int end) {
    if (start > end) {
      throw new InvalidRequestException("Page start cannot be greater than page end");
    }
    if (start < 1) {
      throw new InvalidRequestException("Page numbers must be positive");
    }
  }

  private void checkPageRangeFits(QuizSpec spec) {
    CollectionInfo info = pdfService.getPdfInfo(spec.primaryDocumentId());
    Integer totalPages = info.totalPages();
    if (totalPages != null && totalPages > 0 && spec.pageEnd() > totalPages) {
      throw new InvalidRequestException(
          "Page range "
              + spec.pageStart()
              + "-"
              + spec.pageEnd()
              + " exceeds PDF length ("
              + totalPages
              + " pages)");
    }
  }
}
