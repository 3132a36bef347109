package com.flamingo.ai.pdfquiz.service.rag.generation;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders the chat prompt and the three quiz prompts. */
@Component
public class PromptBuilder {

  private static final String JSON_FORMAT =
      """
      Return the response in this exact JSON format:
      {
          "questions": [
              {
                  "question": "Question text here?",
                  "options": ["A) Option 1", "B) Option 2", "C) Option 3", "D) Option 4"],
                  "correct_answer": "A) Option 1",
                  "explanation": "%s"
              }
          ]
      }

      Generate %d questions following this format exactly. Do not add any additional text or \
      explanations outside the JSON format.
      """;

  private static final String GROUNDING_RULES =
      """
      Questions should be based on the content provided and not on outside knowledge. Only \
      include a question if it is answerable from the content.
      Prefer mathematical and analytical questions that the content gives enough knowledge to \
      answer, even when they are not stated in it directly.
      If a question is theoretical it must come directly from the provided content.
      Questions and answers must not rely on any graphical illustration.\
      """;

  private static final String OUTPUT_RULES =
      """
      DO NOT include any text outside the JSON structure.
      DO NOT include any comments or explanations in the response.
      The response must be parseable JSON.\
      """;

  /**
   * Chat prompt grounded in retrieved chunks.
   *
   * @param context retrieved chunk texts joined by blank lines
   * @param history rendered recent turns, possibly empty
   * @param question the user's message
   * @param documentCount number of documents being chatted with
   */
  public String chat(String context, String history, String question, int documentCount) {
    String pdfContext =
        documentCount == 1
            ? "the provided PDF content"
            : "the provided content from " + documentCount + " PDF documents";
    String sourceText = documentCount == 1 ? "the PDF content" : "the PDF documents";
    return """
        You are a helpful AI assistant that answers questions based on %1$s.
        You should be informative, accurate, and helpful while staying grounded in the provided \
        context.

        Conversation History:
        %3$s
        Relevant Content from PDF Documents:
        %4$s

        User Question: %5$s

        Instructions:
        1. Answer the question based primarily on %2$s provided
        2. If the answer is not fully contained in %2$s, clearly state what information is missing
        3. Be specific and cite relevant parts of the content when possible
        4. If you cannot answer the question based on %2$s, say so clearly
        5. Keep your response focused and relevant to the question
        6. When drawing from multiple documents, synthesize the information coherently

        Answer:"""
        .formatted(pdfContext, sourceText, history, context, question);
  }

  /** Quiz about a topic from one document. */
  public String topicQuiz(String context, String topic, int numQuestions, Difficulty difficulty) {
    String level = level(difficulty);
    return """
        Create a %1$s level quiz with %2$d multiple choice questions about "%3$s" based on the \
        following content. Multiple topics are colon separated; cover every topic. You must \
        return the response in the given JSON format.

        Content:
        %4$s

        Requirements:
        1. Each question should have exactly 4 options (A, B, C, D)
        2. Questions should test understanding of the content, not just memorization
        3. For %1$s difficulty: %5$s
        %6$s
        Ensure all information needed to answer is in the provided content.
        Provide clear explanations for correct answers that are enough to understand the concept \
        behind the question.
        %7$s

        %8$s"""
        .formatted(
            level,
            numQuestions,
            topic,
            context,
            singleDocumentGuidance(difficulty),
            GROUNDING_RULES,
            OUTPUT_RULES,
            JSON_FORMAT.formatted(
                "Brief explanation of why this is correct and why others are wrong",
                numQuestions));
  }

  /** Quiz restricted to a page range of one document. */
  public String pageRangeQuiz(
      String context, int pageStart, int pageEnd, int numQuestions, Difficulty difficulty) {
    String level = level(difficulty);
    return """
        Create a %1$s level quiz with %2$d multiple choice questions based on content from pages \
        %3$d to %4$d. You must return the response in the given JSON format.

        Content:
        %5$s

        Requirements:
        1. Each question should have exactly 4 options (A, B, C, D)
        2. Questions should focus specifically on content from the specified page range
        3. For %1$s difficulty: %6$s
        %7$s
        Provide clear explanations for correct answers that are enough to understand the concept \
        behind the question.
        Reference the page range when relevant.
        %8$s

        %9$s"""
        .formatted(
            level,
            numQuestions,
            pageStart,
            pageEnd,
            context,
            singleDocumentGuidance(difficulty),
            GROUNDING_RULES,
            OUTPUT_RULES,
            JSON_FORMAT.formatted(
                "Brief explanation of why this is correct (from pages "
                    + pageStart
                    + "-"
                    + pageEnd
                    + ")",
                numQuestions));
  }

  /** Quiz about a topic drawing on several documents. */
  public String multiDocumentQuiz(
      String context, String topic, int numQuestions, Difficulty difficulty) {
    String level = level(difficulty);
    return """
        Create a %1$s level quiz with %2$d multiple choice questions about "%3$s" based on \
        content from multiple PDF documents. Multiple topics are colon separated; cover every \
        topic. You must return the response in the given JSON format.

        Content from multiple sources:
        %4$s

        Requirements:
        1. Each question should have exactly 4 options (A, B, C, D)
        2. Questions should synthesize information across the different sources
        3. For %1$s difficulty: %5$s
        %6$s
        Ensure all information needed to answer is in the provided content.
        Provide clear explanations for correct answers that are enough to understand the concept \
        behind the question.
        When possible, note if information comes from multiple sources.
        %7$s

        %8$s
        Do not include other topics or unrelated content in the questions."""
        .formatted(
            level,
            numQuestions,
            topic,
            context,
            multiDocumentGuidance(difficulty),
            GROUNDING_RULES,
            OUTPUT_RULES,
            JSON_FORMAT.formatted(
                "Brief explanation of why this is correct, drawing from the multiple sources",
                numQuestions));
  }

  /** Renders the last {@code turns} history entries as {@code Role: content} lines. */
  public String history(List<ChatTurn> history, int turns) {
    if (history == null || history.isEmpty() || turns <= 0) {
      return "";
    }
    StringBuilder text = new StringBuilder();
    for (ChatTurn turn : history.subList(Math.max(0, history.size() - turns), history.size())) {
      text.append(capitalize(turn.role()))
          .append(": ")
          .append(turn.content() == null ? "" : turn.content())
          .append('\n');
    }
    return text.toString();
  }

  static String singleDocumentGuidance(Difficulty difficulty) {
    switch (difficulty) {
      case EASY:
        return "Make questions straightforward and factual";
      case MEDIUM:
        return "Include some analytical and application-based questions";
      default:
        return "Focus on complex analysis and synthesis";
    }
  }

  static String multiDocumentGuidance(Difficulty difficulty) {
    switch (difficulty) {
      case EASY:
        return "Make questions straightforward and factual";
      case MEDIUM:
        return "Include some comparative and analytical questions";
      default:
        return "Focus on synthesis and complex analysis across sources";
    }
  }

  private static String level(Difficulty difficulty) {
    return difficulty.getValue();
  }

  private static String capitalize(String role) {
    String value = role == null || role.isBlank() ? "user" : role.trim();
    return value.substring(0, 1).toUpperCase(Locale.ROOT)
        + value.substring(1).toLowerCase(Locale.ROOT);
  }
}
