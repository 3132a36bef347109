package com.flamingo.ai.pdfquiz.service.job;

import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import com.flamingo.ai.pdfquiz.elasticsearch.DocumentStore;
import com.flamingo.ai.pdfquiz.service.ingest.PageChunker;
import com.flamingo.ai.pdfquiz.service.ingest.PageText;
import com.flamingo.ai.pdfquiz.service.ingest.PdfChunk;
import com.flamingo.ai.pdfquiz.service.ingest.PdfDownloader;
import com.flamingo.ai.pdfquiz.service.ingest.PdfTextExtractor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Downloads, extracts, chunks and indexes one PDF.
 *
 * <p>A request with a page range indexes only those pages; the reported page count is still the
 * whole document's.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestJobHandler implements JobHandler {

  private final JobQueueService jobQueueService;
  private final PdfDownloader pdfDownloader;
  private final PdfTextExtractor pdfTextExtractor;
  private final PageChunker pageChunker;
  private final DocumentStore documentStore;

  @Override
  public JobKind kind() {
    return JobKind.INGEST;
  }

  @Override
  public IngestResult handle(Job job) {
    IngestRequest request = jobQueueService.payload(job, IngestRequest.class);
    log.info("Starting PDF processing for upload {} as {}", request.uploadId(), request.pdfId());

    log.debug("Downloading PDF from {}", request.sourceUrl());
    byte[] content = pdfDownloader.download(request.sourceUrl());

    PageText pages = pdfTextExtractor.extract(content);
    List<PdfChunk> chunks;
    if (request.hasPageRange()) {
      chunks =
          pageChunker.chunkRange(
              pages, request.pdfId(), request.pdfName(), request.pageStart(), request.pageEnd());
    } else {
      chunks = pageChunker.chunk(pages, request.pdfId(), request.pdfName());
    }
    documentStore.add(chunks, request.pdfId());

    log.info(
        "Processed PDF {}: {} pages, {} chunks", request.pdfId(), pages.pageCount(), chunks.size());
    return IngestResult.success(
        request.pdfId(), request.uploadId(), pages.pageCount(), request.pdfName(), chunks.size());
  }
}
