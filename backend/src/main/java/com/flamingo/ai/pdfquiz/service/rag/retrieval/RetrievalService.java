package com.flamingo.ai.pdfquiz.service.rag.retrieval;

import com.flamingo.ai.pdfquiz.elasticsearch.DocumentChunk;
import com.flamingo.ai.pdfquiz.elasticsearch.DocumentStore;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.exception.InvalidPageRangeException;
import com.flamingo.ai.pdfquiz.exception.NoContentInRangeException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves chunks for chat and quiz prompts.
 *
 * <p>Multi-document results are concatenated in document order and cut to {@code k}; scores from
 * different collections are not compared.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  private final DocumentStore documentStore;
  private final MeterRegistry meterRegistry;

  /** Similarity search in one document; empty when the document has no collection. */
  public List<DocumentChunk> search(String query, String documentId, int k) {
    return documentStore.search(query, documentId, k);
  }

  /**
   * Similarity search over several documents.
   *
   * <p>Each document is asked for {@code max(1, k / n) + 1} chunks. A document whose search fails
   * is logged and skipped.
   *
   * @return at most {@code k} chunks
   */
  @Timed(value = "retrieval.multi_search", description = "Time for a multi-document search")
  public List<DocumentChunk> searchMultiple(String query, List<String> documentIds, int k) {
    if (documentIds.isEmpty() || k <= 0) {
      return List.of();
    }
    int perDocument = perDocumentK(k, documentIds.size());
    List<DocumentChunk> merged = new ArrayList<>();
    for (String documentId : documentIds) {
      try {
        merged.addAll(documentStore.search(query, documentId, perDocument));
      } catch (RuntimeException e) {
        log.warn("Search failed for PDF {}, skipping it: {}", documentId, e.getMessage());
        meterRegistry.counter("retrieval.document.failures").increment();
      }
    }
    log.debug(
        "Multi-document search over {} PDFs collected {} chunks (per-document k={})",
        documentIds.size(),
        merged.size(),
        perDocument);
    return merged.size() > k ? new ArrayList<>(merged.subList(0, k)) : merged;
  }

  static int perDocumentK(int k, int documentCount) {
    return Math.max(1, k / documentCount) + 1;
  }

  /**
   * Every chunk whose page falls in {@code [start, end]}, in page order.
   *
   * <p>This is a structural scan of the whole collection, not a similarity search. Chunks of the
   * same page keep their storage order.
   *
   * @throws InvalidPageRangeException if {@code start < 1} or {@code end < start}
   * @throws CollectionNotFoundException if the document has no collection
   * @throws NoContentInRangeException if no chunk falls in the range
   */
  @Timed(value = "retrieval.page_range", description = "Time for a page-range scan")
  public List<DocumentChunk> byPageRange(String documentId, int start, int end) {
    if (start < 1 || end < start) {
      throw new InvalidPageRangeException(start, end);
    }

    List<PagedChunk> inRange = new ArrayList<>();
    int unresolved = 0;
    for (DocumentChunk chunk : documentStore.loadAll(documentId)) {
      Optional<ResolvedPage> page = PageNumberResolver.resolve(chunk.getMetadata());
      if (page.isEmpty()) {
        unresolved++;
        continue;
      }
      int number = page.get().page();
      if (number >= start && number <= end) {
        inRange.add(new PagedChunk(number, chunk));
      }
    }
    if (unresolved > 0) {
      log.warn("Skipped {} chunks of PDF {} with no usable page metadata", unresolved, documentId);
    }
    if (inRange.isEmpty()) {
      log.warn("No chunks found for pages {}-{} in PDF {}", start, end, documentId);
      throw new NoContentInRangeException(documentId, start, end);
    }

    inRange.sort(Comparator.comparingInt(PagedChunk::page));
    log.info("Found {} chunks in pages {}-{} of PDF {}", inRange.size(), start, end, documentId);
    return inRange.stream().map(PagedChunk::chunk).toList();
  }

  /** Page spread and metadata layout counts for a collection. */
  public PageDistribution pageDistribution(String documentId) {
    List<DocumentChunk> chunks = documentStore.loadAll(documentId);
    TreeMap<Integer, Integer> perPage = new TreeMap<>();
    int current = 0;
    int legacy = 0;
    int unresolved = 0;
    for (DocumentChunk chunk : chunks) {
      Optional<ResolvedPage> page = PageNumberResolver.resolve(chunk.getMetadata());
      if (page.isEmpty()) {
        unresolved++;
        continue;
      }
      if (page.get().source() == ResolvedPage.PageSource.CURRENT) {
        current++;
      } else {
        legacy++;
      }
      perPage.merge(page.get().page(), 1, Integer::sum);
    }
    return new PageDistribution(
        documentId,
        chunks.size(),
        current,
        legacy,
        unresolved,
        perPage,
        perPage.isEmpty() ? null : perPage.firstKey(),
        perPage.isEmpty() ? null : perPage.lastKey());
  }

  private record PagedChunk(int page, DocumentChunk chunk) {}
}
