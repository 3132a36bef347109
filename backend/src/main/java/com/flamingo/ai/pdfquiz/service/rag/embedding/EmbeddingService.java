package com.flamingo.ai.pdfquiz.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings with the configured embedding model.
 *
 * <p>Failures propagate to the caller; there is no fallback vector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below it for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query, 0));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds a batch of chunk texts in one model call.
   *
   * @param passages the chunk texts
   * @return one vector per passage, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai")
  public List<List<Float>> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(passages.size());
    for (int i = 0; i < passages.size(); i++) {
      segments.add(TextSegment.from(truncate(passages.get(i), i)));
    }

    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != passages.size()) {
      throw new IllegalStateException(
          "Embedding model returned "
              + embeddings.size()
              + " vectors for "
              + passages.size()
              + " passages");
    }

    List<List<Float>> results = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return results;
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
