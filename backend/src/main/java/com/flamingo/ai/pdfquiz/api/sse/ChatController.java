package com.flamingo.ai.pdfquiz.api.sse;

import com.flamingo.ai.pdfquiz.api.dto.request.ChatRequest;
import com.flamingo.ai.pdfquiz.api.dto.response.ChatResponse;
import com.flamingo.ai.pdfquiz.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.pdfquiz.service.chat.ChatService;
import com.flamingo.ai.pdfquiz.service.pdf.PdfService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for chat with PDFs, blocking and SSE streaming. */
@RestController
@RequestMapping("/pdf")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final PdfService pdfService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Answers a question about one or more PDFs.
   *
   * @param request the PDFs, the question and recent history
   * @return the answer with its source labels
   */
  @PostMapping("/chat")
  public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
    pdfService.requireIndexed(request.getPdfIds());
    log.info("Processing chat request for {} PDFs", request.getPdfIds().size());
    return ResponseEntity.ok(
        ChatResponse.fromAnswer(
            chatService.chat(
                request.getPdfIds(), request.getMessage(), request.getConversationHistory())));
  }

  /**
   * Streams an answer using Server-Sent Events.
   *
   * @param request the PDFs, the question and recent history
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> streamChat(@Valid @RequestBody ChatRequest request) {
    pdfService.requireIndexed(request.getPdfIds());
    log.info("Starting chat stream for {} PDFs", request.getPdfIds().size());
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return chatService
        .streamChat(request.getPdfIds(), request.getMessage(), request.getConversationHistory())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream completed");
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Chat stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream cancelled");
            });
  }
}
