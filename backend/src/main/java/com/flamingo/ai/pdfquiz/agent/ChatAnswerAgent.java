package com.flamingo.ai.pdfquiz.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that answers a rendered RAG chat prompt in one blocking call. */
public interface ChatAnswerAgent {

  @UserMessage("{{prompt}}")
  String answer(@V("prompt") String prompt);
}
