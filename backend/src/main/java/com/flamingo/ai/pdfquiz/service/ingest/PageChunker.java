package com.flamingo.ai.pdfquiz.service.ingest;

import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits page text into overlapping fixed-size chunks, one page at a time.
 *
 * <p>Windows never cross a page boundary, so every chunk carries exactly one page number. Inside a
 * page the window prefers to end on a paragraph break, then a line break, then a space, and the
 * next window starts {@code overlap} characters back, moved forward to a word start.
 */
@Component
@Slf4j
public class PageChunker {

  private final int chunkSize;
  private final int overlap;

  @Autowired
  public PageChunker(RagConfig ragConfig) {
    this(ragConfig.getChunking().getSize(), ragConfig.getChunking().getOverlap());
  }

  @VisibleForTesting
  PageChunker(int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Chunk overlap must be in [0, " + chunkSize + "), got " + overlap);
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  /**
   * Chunks every page of a document.
   *
   * @param pageText extracted pages
   * @param documentId owning document
   * @param documentName display name, or {@code null} for {@code document_<id>}
   * @return chunks ordered by page, then by position on the page
   */
  public List<PdfChunk> chunk(PageText pageText, String documentId, String documentName) {
    return chunkPages(pageText, pageText.pageCount(), documentId, documentName);
  }

  /**
   * Chunks only the pages in {@code [start, end]}.
   *
   * <p>{@code totalPages} on each chunk still reports the whole document.
   */
  public List<PdfChunk> chunkRange(
      PageText pageText, String documentId, String documentName, int start, int end) {
    PageText selected = pageText.range(start, end);
    log.debug(
        "Chunking pages {}-{} of {} ({} pages selected)",
        start,
        end,
        documentId,
        selected.pageCount());
    return chunkPages(selected, pageText.pageCount(), documentId, documentName);
  }

  public static String defaultDocumentName(String documentId) {
    return "document_" + documentId;
  }

  private List<PdfChunk> chunkPages(
      PageText pageText, int totalPages, String documentId, String documentName) {
    String name =
        documentName == null || documentName.isBlank()
            ? defaultDocumentName(documentId)
            : documentName;
    List<PdfChunk> chunks = new ArrayList<>();
    for (Map.Entry<Integer, String> page : pageText.pages().entrySet()) {
      List<String> pieces = split(page.getValue());
      for (int i = 0; i < pieces.size(); i++) {
        chunks.add(new PdfChunk(documentId, page.getKey(), i, pieces.get(i), name, totalPages));
      }
    }
    log.info(
        "Split {} pages of {} into {} chunks", pageText.pageCount(), documentId, chunks.size());
    return chunks;
  }

  @VisibleForTesting
  List<String> split(String text) {
    String source = text == null ? "" : text.strip();
    if (source.isEmpty()) {
      return List.of();
    }
    if (source.length() <= chunkSize) {
      return List.of(source);
    }

    List<String> pieces = new ArrayList<>();
    int length = source.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + chunkSize, length);
      if (end < length) {
        end = findBreak(source, start, end);
      }
      String piece = source.substring(start, end).strip();
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
      if (end >= length) {
        break;
      }
      int next = Math.max(end - overlap, start + 1);
      start = alignToWordStart(source, next, end);
    }
    return pieces;
  }

  /** Latest paragraph, line or word break in the back half of the window, else the hard end. */
  private int findBreak(String text, int start, int end) {
    int floor = start + chunkSize / 2;
    int paragraph = text.lastIndexOf("\n\n", end - 2);
    if (paragraph >= floor) {
      return paragraph + 2;
    }
    int line = text.lastIndexOf('\n', end - 1);
    if (line >= floor) {
      return line + 1;
    }
    int space = text.lastIndexOf(' ', end - 1);
    if (space >= floor) {
      return space + 1;
    }
    return end;
  }

  private int alignToWordStart(String text, int position, int limit) {
    int pos = position;
    if (pos > 0 && !Character.isWhitespace(text.charAt(pos - 1))) {
      int scan = pos;
      while (scan < limit && !Character.isWhitespace(text.charAt(scan))) {
        scan++;
      }
      if (scan < limit) {
        pos = scan;
      }
    }
    while (pos < limit && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }
}
