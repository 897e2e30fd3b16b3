package com.scholary.transcriber.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Complete transcript of one job.
 *
 * <p>Immutable once built. {@code text} is always the segment texts joined by single spaces, so
 * it is derived in {@link #of} rather than accepted from callers.
 */
public record TranscriptionResult(
    String text,
    List<TranscriptSegment> segments,
    String language,
    double duration,
    List<String> warnings) {

  public TranscriptionResult {
    segments = List.copyOf(segments);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static TranscriptionResult of(
      List<TranscriptSegment> segments, String language, double duration, List<String> warnings) {
    String text =
        segments.stream()
            .map(TranscriptSegment::text)
            .filter(t -> !t.isBlank())
            .collect(Collectors.joining(" "));
    return new TranscriptionResult(text, segments, language, duration, warnings);
  }

  public TranscriptionResult withWarning(String warning) {
    List<String> joined = new ArrayList<>(warnings);
    joined.add(warning);
    return new TranscriptionResult(text, segments, language, duration, joined);
  }

  public boolean hasSpeakers() {
    return segments.stream().anyMatch(s -> s.speaker() != null);
  }
}
