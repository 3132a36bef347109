package com.flamingo.ai.pdfquiz.service.chat;

import java.util.List;

/**
 * A complete chat answer.
 *
 * @param response answer text
 * @param sources one label per retrieved chunk, in retrieval order
 */
public record ChatAnswer(String response, List<String> sources) {

  public ChatAnswer {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
