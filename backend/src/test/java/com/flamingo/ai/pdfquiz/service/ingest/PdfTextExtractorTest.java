package com.flamingo.ai.pdfquiz.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdfquiz.exception.ExtractionException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

class PdfTextExtractorTest {

  private final PdfTextExtractor extractor = new PdfTextExtractor();

  @Test
  void shouldExtractTextPerPage() throws IOException {
    byte[] pdf = createPdf("Photosynthesis happens in leaves", null, "Cells divide by mitosis");

    PageText pages = extractor.extract(pdf);

    assertThat(pages.pageCount()).isEqualTo(3);
    assertThat(pages.page(1)).contains("Photosynthesis happens in leaves");
    assertThat(pages.page(3)).contains("Cells divide by mitosis");
  }

  @Test
  void shouldUsePlaceholderForBlankPage() throws IOException {
    byte[] pdf = createPdf("First", null);

    PageText pages = extractor.extract(pdf);

    assertThat(pages.page(2)).isEqualTo(PageText.noTextPlaceholder(2));
  }

  @Test
  void shouldRejectBytesThatAreNotAPdf() {
    byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> extractor.extract(garbage))
        .isInstanceOf(ExtractionException.class)
        .hasMessageStartingWith("Failed to process PDF");
  }

  private static byte[] createPdf(String... pageTexts) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (String text : pageTexts) {
        PDPage page = new PDPage();
        document.addPage(page);
        if (text != null) {
          try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
            stream.beginText();
            stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            stream.newLineAtOffset(72, 700);
            stream.showText(text);
            stream.endText();
          }
        }
      }
      document.save(out);
      return out.toByteArray();
    }
  }
}
