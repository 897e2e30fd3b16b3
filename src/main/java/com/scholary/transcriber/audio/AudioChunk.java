package com.scholary.transcriber.audio;

import java.nio.file.Path;

/**
 * One slice of a normalized file.
 *
 * @param index position of the chunk, starting at 0
 * @param path the chunk's own WAV file
 * @param offsetSeconds where the chunk starts in the normalized file
 * @param durationSeconds length of the chunk
 */
public record AudioChunk(int index, Path path, double offsetSeconds, double durationSeconds) {

  public TimeRange range() {
    return new TimeRange(offsetSeconds, offsetSeconds + durationSeconds);
  }
}
