package com.flamingo.ai.pdfquiz.service.pdf;

import com.flamingo.ai.pdfquiz.elasticsearch.CollectionInfo;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.PageDistribution;
import java.util.List;

/** Service for managing indexed PDFs. */
public interface PdfService {

  List<CollectionInfo> listPdfs();

  /**
   * Describes one indexed PDF.
   *
   * @throws CollectionNotFoundException if the PDF is not indexed
   */
  CollectionInfo getPdfInfo(String pdfId);

  /**
   * Deletes an indexed PDF with all its chunks.
   *
   * @throws CollectionNotFoundException if the PDF is not indexed
   */
  void deletePdf(String pdfId);

  /** Page spread of a PDF's chunks, for diagnosing page-range quizzes. */
  PageDistribution debugPages(String pdfId);

  /**
   * Checks that every PDF is indexed.
   *
   * @throws CollectionNotFoundException for the first PDF that is not
   */
  void requireIndexed(List<String> pdfIds);
}
