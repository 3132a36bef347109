package com.flamingo.ai.pdfquiz.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.service.rag.generation.ChatTurn;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for chatting with one or more PDFs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotEmpty(message = "At least one PDF id is required")
  @JsonProperty("pdf_ids")
  private List<String> pdfIds;

  @NotBlank(message = "Message is required")
  @Size(max = 10000, message = "Message must not exceed 10000 characters")
  private String message;

  /** Earlier turns, oldest first. Only the most recent ones reach the prompt. */
  @JsonProperty("conversation_history")
  private List<ChatTurn> conversationHistory;
}
