package com.flamingo.ai.pdfquiz.api.dto.response;

import com.flamingo.ai.pdfquiz.service.chat.ChatAnswer;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a blocking chat answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

  private String response;

  private List<String> sources;

  public static ChatResponse fromAnswer(ChatAnswer answer) {
    return ChatResponse.builder().response(answer.response()).sources(answer.sources()).build();
  }
}
