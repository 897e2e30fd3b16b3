package com.scholary.transcriber.transcript;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A single recognized word with its own timing, nested inside a {@link TranscriptSegment}. */
public record Word(
    @JsonProperty("word") String text, double start, double end, double confidence) {

  public Word {
    text = text == null ? "" : text;
  }

  Word shifted(double offsetSeconds) {
    return new Word(text, start + offsetSeconds, end + offsetSeconds, confidence);
  }
}
