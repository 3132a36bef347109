package com.flamingo.ai.pdfquiz.service.ingest;

import com.flamingo.ai.pdfquiz.exception.ExtractionException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/** Extracts per-page plain text from PDF bytes with PDFBox. */
@Service
@Slf4j
public class PdfTextExtractor {

  /**
   * Extracts every page of a PDF.
   *
   * <p>A blank page gets the "no extractable text" placeholder and a page whose extraction throws
   * gets the "extraction failed" placeholder; neither aborts the document.
   *
   * @param pdfBytes raw PDF
   * @return page text for pages 1..n
   * @throws ExtractionException if the PDF cannot be opened or has no pages
   */
  @Timed(value = "pdf.extract", description = "Time to extract page text from a PDF")
  public PageText extract(byte[] pdfBytes) {
    try (PDDocument pdf = Loader.loadPDF(pdfBytes)) {
      int pageCount = pdf.getNumberOfPages();
      if (pageCount == 0) {
        throw new ExtractionException("No text could be extracted from the PDF");
      }

      PDFTextStripper stripper = new PDFTextStripper();
      Map<Integer, String> pages = new LinkedHashMap<>();
      for (int page = 1; page <= pageCount; page++) {
        pages.put(page, extractPage(stripper, pdf, page));
      }
      log.info("Extracted text from {} pages", pageCount);
      return PageText.of(pages);
    } catch (IOException e) {
      log.error("PDFBox could not open document: {}", e.getMessage());
      throw new ExtractionException("Failed to process PDF: " + e.getMessage(), e);
    }
  }

  private String extractPage(PDFTextStripper stripper, PDDocument pdf, int page) {
    try {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      String text = stripper.getText(pdf);
      if (text == null || text.isBlank()) {
        log.debug("Page {} has no extractable text", page);
        return PageText.noTextPlaceholder(page);
      }
      return text;
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to extract text from page {}: {}", page, e.getMessage());
      return PageText.extractionFailedPlaceholder(page);
    }
  }
}
