package com.flamingo.ai.pdfquiz.api.rest;

import com.flamingo.ai.pdfquiz.api.dto.request.PdfUploadRequest;
import com.flamingo.ai.pdfquiz.api.dto.response.PdfInfoResponse;
import com.flamingo.ai.pdfquiz.api.dto.response.PdfUploadQueuedResponse;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.service.job.JobSubmissionService;
import com.flamingo.ai.pdfquiz.service.pdf.PdfService;
import com.flamingo.ai.pdfquiz.service.rag.retrieval.PageDistribution;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for PDF ingestion and management. */
@RestController
@RequestMapping("/pdf")
@RequiredArgsConstructor
public class PdfController {

  private final JobSubmissionService jobSubmissionService;
  private final PdfService pdfService;

  /** Queues a PDF for download and indexing. */
  @PostMapping("/upload")
  public ResponseEntity<PdfUploadQueuedResponse> uploadPdf(
      @Valid @RequestBody PdfUploadRequest request) {
    Job job = jobSubmissionService.submitUpload(request);
    return ResponseEntity.ok(PdfUploadQueuedResponse.fromJob(job, request.getUploadId()));
  }

  /** Lists all indexed PDFs. */
  @GetMapping("/list")
  public ResponseEntity<Map<String, Object>> listPdfs() {
    List<PdfInfoResponse> pdfs =
        pdfService.listPdfs().stream().map(PdfInfoResponse::fromInfo).toList();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("pdfs", pdfs);
    body.put("total", pdfs.size());
    return ResponseEntity.ok(body);
  }

  @GetMapping("/{pdfId}/info")
  public ResponseEntity<PdfInfoResponse> getPdfInfo(@PathVariable String pdfId) {
    return ResponseEntity.ok(PdfInfoResponse.fromInfo(pdfService.getPdfInfo(pdfId)));
  }

  /** Deletes a PDF and all of its chunks. */
  @DeleteMapping("/{pdfId}")
  public ResponseEntity<Map<String, Object>> deletePdf(@PathVariable String pdfId) {
    pdfService.deletePdf(pdfId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("deleted", true);
    body.put("message", "PDF " + pdfId + " deleted successfully");
    return ResponseEntity.ok(body);
  }

  /** Reports how a PDF's chunks spread over pages. */
  @GetMapping("/{pdfId}/debug-pages")
  public ResponseEntity<PageDistribution> debugPages(@PathVariable String pdfId) {
    return ResponseEntity.ok(pdfService.debugPages(pdfId));
  }
}
