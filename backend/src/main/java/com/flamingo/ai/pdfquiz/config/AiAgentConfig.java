package com.flamingo.ai.pdfquiz.config;

import com.flamingo.ai.pdfquiz.agent.ChatAnswerAgent;
import com.flamingo.ai.pdfquiz.agent.QuizGenerationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Prompts are assembled by the service layer, so each agent forwards one fully rendered user
 * message to its model.
 */
@Configuration
public class AiAgentConfig {

  /** Quiz agent on the JSON-mode model. */
  @Bean
  public QuizGenerationAgent quizGenerationAgent(
      @Qualifier("quizChatModel") ChatModel quizChatModel) {
    return AiServices.builder(QuizGenerationAgent.class).chatModel(quizChatModel).build();
  }

  /** Blocking chat agent on the free-text model. */
  @Bean
  public ChatAnswerAgent chatAnswerAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ChatAnswerAgent.class).chatModel(textChatModel).build();
  }
}
