package com.scholary.transcriber.audio;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decode, resample and cut primitives. The production implementation shells out to ffmpeg; tests
 * substitute a fake.
 */
public interface AudioToolkit {

  /**
   * Read duration and stream layout of a file.
   *
   * @throws IOException if the file cannot be decoded
   */
  AudioInfo probe(Path input) throws IOException;

  /** Convert any supported input to mono 16-bit PCM WAV at {@code sampleRate}. */
  void normalize(Path input, Path output, int sampleRate) throws IOException;

  /** Copy {@code range} of a normalized WAV file into {@code output}. */
  void cut(Path input, TimeRange range, Path output) throws IOException;
}
