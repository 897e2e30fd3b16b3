package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/** Body of every error response. Never carries a stack trace. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    String code,
    String message,
    String details,
    String filename,
    @JsonProperty("expected_formats") List<String> expectedFormats,
    List<String> suggestions,
    Instant timestamp) {

  static ErrorResponse of(String code, String message, String details) {
    return new ErrorResponse(code, message, details, null, List.of(), List.of(), Instant.now());
  }
}
