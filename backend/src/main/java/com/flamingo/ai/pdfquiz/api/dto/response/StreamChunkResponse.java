package com.flamingo.ai.pdfquiz.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE chat chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunkResponse {

  public static final String STATUS = "status";
  public static final String SOURCES = "sources";
  public static final String CONTENT = "content";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  /** Event type: status, sources, content, done, error. */
  @JsonProperty("type")
  private String eventType;

  /** Event data; a list of labels for sources, text otherwise. */
  private Object data;

  public static StreamChunkResponse status(String message) {
    return StreamChunkResponse.builder().eventType(STATUS).data(message).build();
  }

  public static StreamChunkResponse sources(List<String> sources) {
    return StreamChunkResponse.builder().eventType(SOURCES).data(List.copyOf(sources)).build();
  }

  /** Creates a content event carrying one streamed token. */
  public static StreamChunkResponse content(String token) {
    return StreamChunkResponse.builder().eventType(CONTENT).data(token).build();
  }

  public static StreamChunkResponse done() {
    return StreamChunkResponse.builder().eventType(DONE).data("Response completed").build();
  }

  public static StreamChunkResponse error(String message) {
    return StreamChunkResponse.builder().eventType(ERROR).data(message).build();
  }
}
