package com.flamingo.ai.pdfquiz.api.rest;

import com.flamingo.ai.pdfquiz.api.dto.request.QuizRequest;
import com.flamingo.ai.pdfquiz.api.dto.response.QuizQueuedResponse;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.service.job.JobSubmissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for quiz generation. */
@RestController
@RequestMapping("/pdf")
@RequiredArgsConstructor
public class QuizController {

  private final JobSubmissionService jobSubmissionService;

  /** Queues a quiz; the result is delivered to the quiz webhook. */
  @PostMapping("/generate-quiz")
  public ResponseEntity<QuizQueuedResponse> generateQuiz(@Valid @RequestBody QuizRequest request) {
    Job job = jobSubmissionService.submitQuiz(request);
    return ResponseEntity.ok(QuizQueuedResponse.fromJob(job, request.getExamId()));
  }
}
