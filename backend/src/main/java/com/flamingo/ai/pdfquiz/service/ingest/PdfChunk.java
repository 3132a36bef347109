package com.flamingo.ai.pdfquiz.service.ingest;

/**
 * A page-bounded fragment of a document's text.
 *
 * @param documentId owning document
 * @param pageNumber 1-based page the text was cut from
 * @param indexOnPage position among the chunks of the same page, from 0
 * @param content chunk text
 * @param documentName display name of the document
 * @param totalPages number of pages the document had when chunked
 */
public record PdfChunk(
    String documentId,
    int pageNumber,
    int indexOnPage,
    String content,
    String documentName,
    int totalPages) {

  /** Identifier unique within the document, {@code <page>_<indexOnPage>}. */
  public String chunkId() {
    return pageNumber + "_" + indexOnPage;
  }
}
