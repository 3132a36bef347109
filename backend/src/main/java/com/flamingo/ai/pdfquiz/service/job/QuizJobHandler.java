package com.flamingo.ai.pdfquiz.service.job;

import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizGenerationService;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizQuestion;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Generates the quiz described by a job. */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuizJobHandler implements JobHandler {

  private final JobQueueService jobQueueService;
  private final QuizGenerationService quizGenerationService;

  @Override
  public JobKind kind() {
    return JobKind.GENERATE_QUIZ;
  }

  @Override
  public QuizResult handle(Job job) {
    QuizJobRequest request = jobQueueService.payload(job, QuizJobRequest.class);
    log.info(
        "Generating {} quiz {} with {} questions for exam {}",
        request.spec().mode().getValue(),
        request.quizId(),
        request.spec().numQuestions(),
        request.examId());
    List<QuizQuestion> questions = quizGenerationService.generate(request.spec());
    return QuizResult.of(request.quizId(), request.spec(), questions);
  }
}
