package com.scholary.transcriber.transcript;

/**
 * A span during which diarization attributes speech to one speaker.
 *
 * <p>Turns of the same speaker never overlap; turns of different speakers may (crosstalk).
 */
public record SpeakerTurn(double start, double end, String speaker) {

  public double duration() {
    return end - start;
  }

  /** Length of the intersection with {@code [from, to)}, zero when disjoint. */
  public double overlapWith(double from, double to) {
    return Math.max(0.0, Math.min(end, to) - Math.max(start, from));
  }
}
