package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a model reply into quiz questions.
 *
 * <p>The reply is first decoded as JSON. When that yields nothing usable the text is scanned line
 * by line for questions, options, answers and explanations. When the scan finds nothing either a
 * single placeholder question is returned, so the result is never empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuizResponseParser {

  static final String DEFAULT_EXPLANATION = "No explanation provided";

  static final QuizQuestion PLACEHOLDER =
      new QuizQuestion(
          "What is the main topic discussed in the provided content?",
          List.of("A) Topic A", "B) Topic B", "C) Topic C", "D) Topic D"),
          "A) Topic A",
          "This is a fallback question due to parsing issues.");

  private static final int OPTION_COUNT = 4;

  private final ObjectMapper objectMapper;

  /**
   * Parses a reply into at most {@code numQuestions} questions.
   *
   * @return one or more questions
   */
  public List<QuizQuestion> parse(String reply, int numQuestions) {
    String text = reply == null ? "" : reply;
    List<QuizQuestion> questions =
        decodeJson(text)
            .orElseGet(
                () -> {
                  log.warn("Quiz reply is not usable JSON, falling back to line scanning");
                  return scanLines(text);
                });
    if (questions.isEmpty()) {
      log.warn("No questions could be recovered from the quiz reply, using placeholder");
      return List.of(PLACEHOLDER);
    }
    return questions.size() > numQuestions
        ? List.copyOf(questions.subList(0, Math.max(1, numQuestions)))
        : questions;
  }

  /** Strict decode; empty when the reply has no valid questions. */
  Optional<List<QuizQuestion>> decodeJson(String reply) {
    JsonNode root;
    try {
      root = objectMapper.readTree(stripFences(reply));
    } catch (JsonProcessingException e) {
      log.debug("Quiz reply is not JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    if (root == null || !root.path("questions").isArray()) {
      return Optional.empty();
    }
    List<QuizQuestion> questions = new ArrayList<>();
    int index = 0;
    for (JsonNode element : root.get("questions")) {
      index++;
      Optional<QuizQuestion> question = toQuestion(element);
      if (question.isPresent()) {
        questions.add(question.get());
      } else {
        log.warn("Dropping malformed quiz question #{}", index);
      }
    }
    return questions.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(questions));
  }

  private static Optional<QuizQuestion> toQuestion(JsonNode element) {
    String question = text(element, "question");
    String answer = text(element, "correct_answer");
    JsonNode options = element.path("options");
    if (question == null || answer == null || !options.isArray()) {
      return Optional.empty();
    }
    List<String> values = new ArrayList<>();
    for (JsonNode option : options) {
      if (!option.isTextual()) {
        return Optional.empty();
      }
      values.add(option.asText());
    }
    if (values.size() != OPTION_COUNT) {
      return Optional.empty();
    }
    String explanation = text(element, "explanation");
    return Optional.of(
        new QuizQuestion(
            question, values, answer, explanation == null ? DEFAULT_EXPLANATION : explanation));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText();
  }

  static String stripFences(String reply) {
    String text = reply.strip();
    if (text.startsWith("```")) {
      int firstNewline = text.indexOf('\n');
      text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
      if (text.endsWith("```")) {
        text = text.substring(0, text.length() - 3);
      }
    }
    return text.strip();
  }

  /**
   * Line scanner for free-text replies. A line ending in {@code ?} opens a question; lines
   * starting {@code A)} to {@code D)} are options; {@code answer:}, {@code correct:} or {@code
   * correct answer:} give the answer; {@code explanation:} or {@code because:} the explanation.
   * Questions without options or an answer are dropped.
   */
  List<QuizQuestion> scanLines(String reply) {
    List<QuizQuestion> questions = new ArrayList<>();
    String question = null;
    List<String> options = new ArrayList<>();
    String answer = null;
    String explanation = null;

    for (String raw : reply.strip().split("\n")) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      String lower = line.toLowerCase(Locale.ROOT);
      if (line.endsWith("?") && !isOption(line)) {
        addIfComplete(questions, question, options, answer, explanation);
        question = line;
        options = new ArrayList<>();
        answer = null;
        explanation = null;
      } else if (isOption(line)) {
        options.add(line);
      } else if (lower.startsWith("correct:")
          || lower.startsWith("answer:")
          || lower.startsWith("correct answer:")) {
        answer = afterColon(line);
      } else if (lower.startsWith("explanation:") || lower.startsWith("because:")) {
        explanation = afterColon(line);
      }
    }
    addIfComplete(questions, question, options, answer, explanation);
    return questions;
  }

  private static void addIfComplete(
      List<QuizQuestion> questions,
      String question,
      List<String> options,
      String answer,
      String explanation) {
    if (question != null && !options.isEmpty() && answer != null && !answer.isEmpty()) {
      questions.add(
          new QuizQuestion(
              question, options, answer, explanation == null ? DEFAULT_EXPLANATION : explanation));
    }
  }

  private static boolean isOption(String line) {
    return line.startsWith("A)")
        || line.startsWith("B)")
        || line.startsWith("C)")
        || line.startsWith("D)");
  }

  private static String afterColon(String line) {
    return line.substring(line.indexOf(':') + 1).strip();
  }
}
