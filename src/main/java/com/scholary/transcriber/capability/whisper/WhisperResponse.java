package com.scholary.transcriber.capability.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Mirrors faster-whisper's output: segments carry {@code avg_logprob}, words carry {@code
 * probability}. Servers that already report a 0..1 {@code confidence} per segment may send it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<Segment> segments, String language, Double duration) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Segment(
      Integer id,
      double start,
      double end,
      String text,
      @JsonProperty("avg_logprob") Double avgLogprob,
      Double confidence,
      List<WordTiming> words) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WordTiming(String word, double start, double end, Double probability) {}
}
