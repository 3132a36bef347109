package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.flamingo.ai.pdfquiz.agent.QuizGenerationAgent;
import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.elasticsearch.DocumentChunk;
import com.flamingo.ai.pdfquiz.exception.QuizGenerationException;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.RetrievalService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates multiple-choice quizzes from retrieved document content.
 *
 * <p>Retrieval errors such as an empty page range propagate unchanged. A failing completion call
 * is reported as {@link QuizGenerationException}; an unparseable completion is not an error and
 * degrades to the parser's fallbacks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuizGenerationService {

  private final RetrievalService retrievalService;
  private final PromptBuilder promptBuilder;
  private final QuizResponseParser responseParser;
  private final QuizGenerationAgent quizGenerationAgent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Builds a quiz for the given request.
   *
   * @return between 1 and {@code spec.numQuestions()} questions
   * @throws QuizGenerationException if no content was found or the model call failed
   */
  @Timed(value = "quiz.generate", description = "Time to generate a quiz")
  public List<QuizQuestion> generate(QuizSpec spec) {
    log.info(
        "Generating {} quiz: pdfs={}, questions={}, difficulty={}",
        spec.mode().getValue(),
        spec.documentIds(),
        spec.numQuestions(),
        spec.difficulty().getValue());

    String context = context(spec);
    if (context.isBlank()) {
      throw new QuizGenerationException("No relevant content found for quiz generation");
    }

    String prompt = prompt(spec, context);
    String reply;
    try {
      reply = quizGenerationAgent.complete(prompt);
    } catch (RuntimeException e) {
      meterRegistry.counter("quiz.generation.failures", "mode", spec.mode().getValue()).increment();
      throw new QuizGenerationException("Failed to generate quiz: " + e.getMessage(), e);
    }

    List<QuizQuestion> questions = responseParser.parse(reply, spec.numQuestions());
    meterRegistry
        .counter("quiz.questions.generated", "mode", spec.mode().getValue())
        .increment(questions.size());
    log.info("Generated {} questions for {} quiz", questions.size(), spec.mode().getValue());
    return questions;
  }

  private String context(QuizSpec spec) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    List<DocumentChunk> chunks;
    switch (spec.mode()) {
      case MULTI_PDF_TOPIC:
        chunks =
            retrievalService.searchMultiple(
                spec.topic(), spec.documentIds(), retrieval.getQuizMultiTopK());
        break;
      case TOPIC:
        chunks =
            retrievalService.search(
                spec.topic(), spec.primaryDocumentId(), retrieval.getQuizTopicTopK());
        break;
      default:
        chunks =
            retrievalService.byPageRange(
                spec.primaryDocumentId(), spec.pageStart(), spec.pageEnd());
        break;
    }
    return chunks.stream().map(DocumentChunk::getContent).collect(Collectors.joining("\n\n"));
  }

  private String prompt(QuizSpec spec, String context) {
    switch (spec.mode()) {
      case MULTI_PDF_TOPIC:
        return promptBuilder.multiDocumentQuiz(
            context, spec.topic(), spec.numQuestions(), spec.difficulty());
      case TOPIC:
        return promptBuilder.topicQuiz(
            context, spec.topic(), spec.numQuestions(), spec.difficulty());
      default:
        return promptBuilder.pageRangeQuiz(
            context, spec.pageStart(), spec.pageEnd(), spec.numQuestions(), spec.difficulty());
    }
  }
}
