package com.scholary.transcriber.audio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A normalized (mono, 16 kHz, 16-bit PCM WAV) copy of an upload, plus its chunks when the file
 * was long enough to be split.
 *
 * <p>The asset owns {@code workDir}: {@link #release()} deletes it with everything inside.
 */
public record AudioAsset(
    Path normalizedPath,
    Path workDir,
    double durationSeconds,
    int sampleRate,
    int channels,
    String sourceFormat,
    List<AudioChunk> chunks) {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioAsset.class);

  public AudioAsset {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public boolean isChunked() {
    return chunks.size() > 1;
  }

  /** Delete the normalized file, the chunks and the work directory. Safe to call twice. */
  public void release() {
    for (AudioChunk chunk : chunks) {
      deleteQuietly(chunk.path());
    }
    deleteQuietly(normalizedPath);
    if (workDir != null) {
      deleteQuietly(workDir);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
