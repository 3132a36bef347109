package com.flamingo.ai.pdfquiz.service.chat;

import com.flamingo.ai.pdfquiz.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.pdfquiz.service.rag.generation.ChatTurn;
import java.util.List;
import reactor.core.publisher.Flux;

/** Service for RAG chat over one or more PDFs. */
public interface ChatService {

  /**
   * Answers a question in one blocking call.
   *
   * @param documentIds PDFs to search
   * @param message the user's question
   * @param history earlier turns, oldest first; only the most recent ones are used
   * @return the answer and the labels of the chunks it was grounded on
   */
  ChatAnswer chat(List<String> documentIds, String message, List<ChatTurn> history);

  /**
   * Streams an answer. The flux emits a status event, the sources, a second status event, the
   * content tokens in generation order and finally a done event. Failures end the flux with a
   * single error event instead of an error signal.
   *
   * @param documentIds PDFs to search
   * @param message the user's question
   * @param history earlier turns, oldest first
   * @return a Flux of stream chunk responses
   */
  Flux<StreamChunkResponse> streamChat(
      List<String> documentIds, String message, List<ChatTurn> history);
}
