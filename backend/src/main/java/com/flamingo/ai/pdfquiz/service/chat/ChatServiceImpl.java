package com.flamingo.ai.pdfquiz.service.chat;

import com.flamingo.ai.pdfquiz.agent.ChatAnswerAgent;
import com.flamingo.ai.pdfquiz.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.elasticsearch.DocumentChunk;
import com.flamingo.ai.pdfquiz.exception.LlmServiceException;
import com.flamingo.ai.pdfquiz.service.rag.generation.ChatTurn;
import com.flamingo.ai.pdfquiz.service.rag.generation.PromptBuilder;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.RetrievalService;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Implementation of {@link ChatService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final String NO_DOCUMENTS =
      "No PDFs specified. Please select at least one PDF to chat with.";

  private final RetrievalService retrievalService;
  private final PromptBuilder promptBuilder;
  private final ChatAnswerAgent chatAnswerAgent;
  private final StreamingChatModel streamingChatModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public ChatAnswer chat(List<String> documentIds, String message, List<ChatTurn> history) {
    if (documentIds == null || documentIds.isEmpty()) {
      return new ChatAnswer(NO_DOCUMENTS, List.of());
    }
    log.info("Processing chat request for {} PDFs: {}", documentIds.size(), documentIds);

    List<DocumentChunk> chunks = retrieve(documentIds, message);
    if (chunks.isEmpty()) {
      return new ChatAnswer(nothingFound(documentIds.size()), List.of());
    }

    String prompt = prompt(documentIds, message, history, chunks);
    String response;
    try {
      response = chatAnswerAgent.answer(prompt);
    } catch (RuntimeException e) {
      meterRegistry.counter("chat.errors").increment();
      throw new LlmServiceException("Chat completion failed: " + e.getMessage(), e);
    }
    meterRegistry.counter("chat.messages.generated", "mode", "blocking").increment();
    return new ChatAnswer(response, sources(chunks, documentIds.size()));
  }

  @Override
  public Flux<StreamChunkResponse> streamChat(
      List<String> documentIds, String message, List<ChatTurn> history) {
    if (documentIds == null || documentIds.isEmpty()) {
      return Flux.just(StreamChunkResponse.error(NO_DOCUMENTS));
    }
    log.info("Processing streaming chat request for {} PDFs: {}", documentIds.size(), documentIds);

    Sinks.Many<StreamChunkResponse> sink = Sinks.many().unicast().onBackpressureBuffer();
    sink.tryEmitNext(StreamChunkResponse.status("Searching relevant documents..."));

    String prompt;
    try {
      List<DocumentChunk> chunks = retrieve(documentIds, message);
      if (chunks.isEmpty()) {
        sink.tryEmitNext(StreamChunkResponse.error(nothingFound(documentIds.size())));
        sink.tryEmitComplete();
        return sink.asFlux();
      }
      sink.tryEmitNext(StreamChunkResponse.sources(sources(chunks, documentIds.size())));
      prompt = prompt(documentIds, message, history, chunks);
    } catch (RuntimeException e) {
      log.error("Error preparing chat stream: {}", e.getMessage(), e);
      failStream(sink, e);
      return sink.asFlux();
    }

    sink.tryEmitNext(StreamChunkResponse.status("Generating response..."));
    AtomicInteger tokenCount = new AtomicInteger(0);
    try {
      streamingChatModel.chat(
          prompt,
          new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String token) {
              if (token == null || token.isEmpty()) {
                return;
              }
              tokenCount.incrementAndGet();
              var result = sink.tryEmitNext(StreamChunkResponse.content(token));
              if (result.isFailure()) {
                log.warn("Failed to emit token: {}", result);
              }
            }

            @Override
            public void onCompleteResponse(ChatResponse response) {
              log.debug("Chat stream completed with {} tokens", tokenCount.get());
              meterRegistry.counter("chat.messages.generated", "mode", "stream").increment();
              meterRegistry.counter("chat.tokens.generated").increment(tokenCount.get());
              sink.tryEmitNext(StreamChunkResponse.done());
              sink.tryEmitComplete();
            }

            @Override
            public void onError(Throwable error) {
              log.error("Error during chat streaming: {}", error.getMessage(), error);
              failStream(sink, error);
            }
          });
    } catch (RuntimeException e) {
      log.error("Chat stream could not be started: {}", e.getMessage(), e);
      failStream(sink, e);
    }
    return sink.asFlux();
  }

  private List<DocumentChunk> retrieve(List<String> documentIds, String message) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (documentIds.size() == 1) {
      return retrievalService.search(message, documentIds.get(0), retrieval.getChatSingleTopK());
    }
    return retrievalService.searchMultiple(message, documentIds, retrieval.getChatMultiTopK());
  }

  private String prompt(
      List<String> documentIds,
      String message,
      List<ChatTurn> history,
      List<DocumentChunk> chunks) {
    String context =
        chunks.stream().map(DocumentChunk::getContent).collect(Collectors.joining("\n\n"));
    return promptBuilder.chat(
        context,
        promptBuilder.history(history, ragConfig.getChat().getHistoryTurns()),
        message,
        documentIds.size());
  }

  private void failStream(Sinks.Many<StreamChunkResponse> sink, Throwable error) {
    meterRegistry.counter("chat.errors").increment();
    sink.tryEmitNext(
        StreamChunkResponse.error(
            "I'm sorry, I encountered an error while processing your question: "
                + error.getMessage()));
    sink.tryEmitComplete();
  }

  static List<String> sources(List<DocumentChunk> chunks, int documentCount) {
    return chunks.stream()
        .map(
            chunk -> {
              String chunkId = chunk.getChunkId() == null ? "unknown" : chunk.getChunkId();
              if (documentCount > 1) {
                String name =
                    chunk.getDocumentName() == null ? "Unknown PDF" : chunk.getDocumentName();
                return name + " - Chunk " + chunkId;
              }
              return "Chunk " + chunkId;
            })
        .toList();
  }

  static String nothingFound(int documentCount) {
    String pdfText = documentCount == 1 ? "PDF" : documentCount + " PDFs";
    return "I couldn't find any relevant information in the "
        + pdfText
        + " to answer your question. Please make sure the PDFs have been uploaded and processed"
        + " correctly.";
  }
}
