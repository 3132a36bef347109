package com.flamingo.ai.pdfquiz.service.pdf;

import com.flamingo.ai.pdfquiz.elasticsearch.CollectionInfo;
import com.flamingo.ai.pdfquiz.elasticsearch.DocumentStore;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.PageDistribution;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.RetrievalService;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link PdfService} over the document store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfServiceImpl implements PdfService {

  private final DocumentStore documentStore;
  private final RetrievalService retrievalService;

  @Override
  @Timed(value = "pdf.list", description = "Time to list indexed PDFs")
  public List<CollectionInfo> listPdfs() {
    return documentStore.listAll();
  }

  @Override
  public CollectionInfo getPdfInfo(String pdfId) {
    return documentStore.describe(pdfId);
  }

  @Override
  public void deletePdf(String pdfId) {
    if (!documentStore.delete(pdfId)) {
      throw new CollectionNotFoundException(pdfId);
    }
    log.info("Deleted PDF {}", pdfId);
  }

  @Override
  public PageDistribution debugPages(String pdfId) {
    PageDistribution distribution = retrievalService.pageDistribution(pdfId);
    log.info(
        "Page debug for {}: {} chunks, pages {}-{}, {} unresolved",
        pdfId,
        distribution.totalChunks(),
        distribution.minPage(),
        distribution.maxPage(),
        distribution.unresolvedChunks());
    return distribution;
  }

  @Override
  public void requireIndexed(List<String> pdfIds) {
    for (String pdfId : pdfIds) {
      if (!documentStore.exists(pdfId)) {
        throw new CollectionNotFoundException(pdfId);
      }
    }
  }
}
