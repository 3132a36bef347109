package com.flamingo.ai.pdfquiz.service.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizSpec;

/**
 * Payload of a quiz generation job.
 *
 * @param quizId id assigned at enqueue time
 * @param examId caller's exam handle, echoed in the webhook
 * @param spec what to generate
 */
public record QuizJobRequest(
    @JsonProperty("quiz_id") String quizId,
    @JsonProperty("exam_id") Long examId,
    @JsonProperty("request") QuizSpec spec) {}
