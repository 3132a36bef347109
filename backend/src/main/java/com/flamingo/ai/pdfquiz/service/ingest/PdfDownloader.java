package com.flamingo.ai.pdfquiz.service.ingest;

import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.exception.DocumentProcessingException;
import com.flamingo.ai.pdfquiz.exception.NotAPdfException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Fetches a PDF by URL and checks that the body really is one. */
@Component
@Slf4j
public class PdfDownloader {

  private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

  private final WebClient webClient;
  private final Duration timeout;

  public PdfDownloader(WebClient.Builder webClientBuilder, RagConfig ragConfig) {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    this.timeout = Duration.ofSeconds(ingestion.getDownloadTimeoutSeconds());
    this.webClient =
        webClientBuilder
            .codecs(c -> c.defaultCodecs().maxInMemorySize(ingestion.getMaxDownloadBytes()))
            .build();
  }

  /**
   * Downloads a PDF.
   *
   * @param url absolute source URL
   * @return the body bytes
   * @throws NotAPdfException if the content type lacks {@code application/pdf} and the body does
   *     not start with {@code %PDF}
   * @throws DocumentProcessingException if the request fails or times out
   */
  public byte[] download(String url) {
    log.info("Downloading PDF from: {}", url);
    ResponseEntity<byte[]> response;
    try {
      response =
          webClient
              .get()
              .uri(URI.create(url))
              .retrieve()
              .toEntity(byte[].class)
              .timeout(timeout)
              .block();
    } catch (RuntimeException e) {
      log.error("Failed to download PDF from {}: {}", url, e.getMessage());
      throw new DocumentProcessingException(
          null, "Failed to download PDF from URL: " + e.getMessage(), e);
    }

    byte[] body = response == null || response.getBody() == null ? new byte[0] : response.getBody();
    String contentType =
        response == null ? "" : response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
    if (!isPdf(contentType, body)) {
      throw new NotAPdfException(url, contentType);
    }
    log.debug("Downloaded {} bytes from {}", body.length, url);
    return body;
  }

  static boolean isPdf(String contentType, byte[] body) {
    if (contentType != null && contentType.toLowerCase().contains("application/pdf")) {
      return true;
    }
    return body.length >= PDF_MAGIC.length
        && Arrays.equals(Arrays.copyOf(body, PDF_MAGIC.length), PDF_MAGIC);
  }
}
