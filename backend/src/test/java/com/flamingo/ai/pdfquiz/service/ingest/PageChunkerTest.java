package com.flamingo.ai.pdfquiz.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdfquiz.exception.EmptyPageRangeException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageChunker Tests")
class PageChunkerTest {

  private final PageChunker chunker = new PageChunker(100, 20);

  @Test
  @DisplayName("Should keep a short page as a single chunk")
  void shouldKeepShortPageAsSingleChunk() {
    PageText pages = PageText.of(Map.of(1, "  A short page.  "));

    List<PdfChunk> chunks = chunker.chunk(pages, "doc-1", "Biology");

    assertThat(chunks).hasSize(1);
    PdfChunk chunk = chunks.get(0);
    assertThat(chunk.content()).isEqualTo("A short page.");
    assertThat(chunk.pageNumber()).isEqualTo(1);
    assertThat(chunk.chunkId()).isEqualTo("1_0");
    assertThat(chunk.documentName()).isEqualTo("Biology");
    assertThat(chunk.totalPages()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should never let a chunk span two pages")
  void shouldNeverSpanPages() {
    String longPage = "word ".repeat(60);
    PageText pages = PageText.of(Map.of(1, longPage, 2, "Second page text."));

    List<PdfChunk> chunks = chunker.chunk(pages, "doc-1", null);

    assertThat(chunks).extracting(PdfChunk::pageNumber).containsOnly(1, 2);
    assertThat(chunks.get(chunks.size() - 1).content()).isEqualTo("Second page text.");
    assertThat(chunks).filteredOn(c -> c.pageNumber() == 1).hasSizeGreaterThan(1);
    assertThat(chunks).allSatisfy(c -> assertThat(c.content().length()).isLessThanOrEqualTo(100));
    assertThat(chunks).allSatisfy(c -> assertThat(c.documentName()).isEqualTo("document_doc-1"));
  }

  @Test
  @DisplayName("Should number chunks per page from zero")
  void shouldNumberChunksPerPage() {
    PageText pages = PageText.of(Map.of(3, "word ".repeat(60)));

    List<PdfChunk> chunks = chunker.chunk(pages, "doc-1", "Doc");

    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).chunkId()).isEqualTo("3_" + i);
    }
  }

  @Test
  @DisplayName("Should overlap consecutive chunks of a page")
  void shouldOverlapConsecutiveChunks() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      text.append("w").append(i).append(' ');
    }

    List<String> pieces = chunker.split(text.toString());

    assertThat(pieces).hasSizeGreaterThan(1);
    String first = pieces.get(0);
    String lastWordOfFirst = first.substring(first.lastIndexOf(' ') + 1);
    assertThat(pieces.get(1)).contains(lastWordOfFirst);
  }

  @Test
  @DisplayName("Should prefer a paragraph break when cutting")
  void shouldPreferParagraphBreak() {
    String text = "a".repeat(70) + "\n\n" + "b".repeat(70);

    List<String> pieces = chunker.split(text);

    assertThat(pieces.get(0)).isEqualTo("a".repeat(70));
  }

  @Test
  @DisplayName("Should skip blank pages")
  void shouldSkipBlankPages() {
    assertThat(chunker.split("   \n  ")).isEmpty();
    assertThat(chunker.split(null)).isEmpty();
  }

  @Test
  @DisplayName("Should report full page count when chunking a range")
  void shouldReportFullPageCountForRange() {
    PageText pages = PageText.of(Map.of(1, "one", 2, "two", 3, "three", 4, "four"));

    List<PdfChunk> chunks = chunker.chunkRange(pages, "doc-1", "Doc", 2, 3);

    assertThat(chunks).extracting(PdfChunk::pageNumber).containsExactly(2, 3);
    assertThat(chunks).allSatisfy(c -> assertThat(c.totalPages()).isEqualTo(4));
  }

  @Test
  @DisplayName("Should reject a range with no pages")
  void shouldRejectEmptyRange() {
    PageText pages = PageText.of(Map.of(1, "one", 2, "two"));

    assertThatThrownBy(() -> chunker.chunkRange(pages, "doc-1", "Doc", 5, 9))
        .isInstanceOf(EmptyPageRangeException.class);
  }

  @Test
  @DisplayName("Should reject overlap not smaller than chunk size")
  void shouldRejectInvalidOverlap() {
    assertThatThrownBy(() -> new PageChunker(100, 100))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PageChunker(0, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
