package com.scholary.transcriber.transcript;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;

/**
 * A contiguous span of transcript text.
 *
 * <p>Timestamps are seconds on the timeline of the original file once the coordinator has shifted
 * chunk-local segments. {@code speaker} is null until diarization assigns one; {@code words} is
 * empty when the recognizer did not return word timings.
 *
 * <p>The record does not reject bad intervals itself: recognizers occasionally emit zero-length
 * or overlapping segments, and {@link SegmentSequences#normalize(List)} repairs those before a
 * result is built.
 */
public record TranscriptSegment(
    int id,
    String text,
    double start,
    double end,
    double confidence,
    @JsonInclude(JsonInclude.Include.NON_NULL) String speaker,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Word> words) {

  public TranscriptSegment {
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
  }

  public TranscriptSegment(int id, String text, double start, double end, double confidence) {
    this(id, text, start, end, confidence, null, List.of());
  }

  @JsonIgnore
  public double duration() {
    return end - start;
  }

  @JsonIgnore
  public boolean hasWords() {
    return !words.isEmpty();
  }

  public TranscriptSegment withId(int newId) {
    return new TranscriptSegment(newId, text, start, end, confidence, speaker, words);
  }

  public TranscriptSegment withSpeaker(String newSpeaker) {
    return new TranscriptSegment(id, text, start, end, confidence, newSpeaker, words);
  }

  TranscriptSegment withBounds(double newStart, double newEnd) {
    return new TranscriptSegment(id, text, newStart, newEnd, confidence, speaker, words);
  }

  /** Move the segment and its words onto the full-file timeline. */
  public TranscriptSegment shifted(double offsetSeconds) {
    if (offsetSeconds == 0.0) {
      return this;
    }
    List<Word> shiftedWords = new ArrayList<>(words.size());
    for (Word word : words) {
      shiftedWords.add(word.shifted(offsetSeconds));
    }
    return new TranscriptSegment(
        id, text, start + offsetSeconds, end + offsetSeconds, confidence, speaker, shiftedWords);
  }

  /** Append another segment's text and words, keeping this segment's speaker and start. */
  TranscriptSegment absorb(TranscriptSegment other) {
    List<Word> joinedWords = new ArrayList<>(words);
    joinedWords.addAll(other.words());
    String joinedText =
        text.isBlank() ? other.text() : other.text().isBlank() ? text : text + " " + other.text();
    return new TranscriptSegment(
        id,
        joinedText,
        start,
        Math.max(end, other.end()),
        Math.min(confidence, other.confidence()),
        speaker,
        joinedWords);
  }
}
