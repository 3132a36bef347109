package com.flamingo.ai.pdfquiz.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that completes a rendered quiz prompt into raw model output, ideally JSON. */
public interface QuizGenerationAgent {

  @UserMessage("{{prompt}}")
  String complete(@V("prompt") String prompt);
}
