package com.flamingo.ai.pdfquiz.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfquiz.elasticsearch.DocumentStore;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.PageDistribution;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.RetrievalService;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PdfServiceImplTest {

  @Mock private DocumentStore documentStore;
  @Mock private RetrievalService retrievalService;

  private PdfServiceImpl pdfService;

  @BeforeEach
  void setUp() {
    pdfService = new PdfServiceImpl(documentStore, retrievalService);
  }

  @Test
  void shouldDeleteExistingPdf() {
    when(documentStore.delete("pdf-1")).thenReturn(true);

    assertThatCode(() -> pdfService.deletePdf("pdf-1")).doesNotThrowAnyException();
  }

  @Test
  void shouldReportDeletingMissingPdf() {
    when(documentStore.delete("nope")).thenReturn(false);

    assertThatThrownBy(() -> pdfService.deletePdf("nope"))
        .isInstanceOf(CollectionNotFoundException.class);
  }

  @Test
  void shouldStopAtFirstUnindexedPdf() {
    when(documentStore.exists("a")).thenReturn(true);
    when(documentStore.exists("b")).thenReturn(false);

    assertThatThrownBy(() -> pdfService.requireIndexed(List.of("a", "b", "c")))
        .isInstanceOf(CollectionNotFoundException.class);
    verify(documentStore, never()).exists("c");
  }

  @Test
  void shouldDelegatePageDebugToRetrieval() {
    PageDistribution distribution =
        new PageDistribution("pdf-1", 2, 2, 0, 0, new TreeMap<>(Map.of(1, 1, 3, 1)), 1, 3);
    when(retrievalService.pageDistribution("pdf-1")).thenReturn(distribution);

    assertThat(pdfService.debugPages("pdf-1")).isSameAs(distribution);
  }
}
