package com.scholary.transcriber.audio;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plans chunk boundaries for a normalized file.
 *
 * <p>Files up to the threshold are a single range. Longer files are cut into consecutive ranges of
 * {@code chunkSeconds} with no overlap and no gap; a tail shorter than {@link #MIN_TAIL_SECONDS}
 * is folded into the previous chunk.
 */
@Component
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

  static final double MIN_TAIL_SECONDS = 1.0;

  // Hard limit: a 500 MB upload never needs this many chunks.
  private static final int MAX_CHUNKS = 1000;

  private final double thresholdSeconds;
  private final double chunkSeconds;

  public ChunkPlanner(AudioProperties properties) {
    this(properties.chunkThresholdSeconds(), properties.chunkSeconds());
  }

  ChunkPlanner(double thresholdSeconds, double chunkSeconds) {
    if (chunkSeconds <= 0) {
      throw new IllegalArgumentException("Chunk duration must be positive");
    }
    this.thresholdSeconds = thresholdSeconds;
    this.chunkSeconds = chunkSeconds;
  }

  /**
   * Plan the ranges covering {@code [0, totalSeconds)}.
   *
   * @throws IllegalArgumentException if the duration is not positive
   * @throws AudioProcessingException if the duration needs more chunks than a job may have
   */
  public List<TimeRange> plan(double totalSeconds) {
    if (totalSeconds <= 0) {
      throw new IllegalArgumentException("Total duration must be positive");
    }
    if (totalSeconds <= thresholdSeconds) {
      return List.of(new TimeRange(0.0, totalSeconds));
    }

    List<TimeRange> ranges = new ArrayList<>();
    double start = 0.0;
    while (start < totalSeconds) {
      double end = Math.min(start + chunkSeconds, totalSeconds);
      if (totalSeconds - end < MIN_TAIL_SECONDS) {
        end = totalSeconds;
      }
      ranges.add(new TimeRange(start, end));
      start = end;

      if (ranges.size() > MAX_CHUNKS) {
        throw new AudioProcessingException(
            "Audio is too long to process",
            String.format(
                Locale.ROOT,
                "Duration %.1fs needs more than %d chunks of %.1fs",
                totalSeconds,
                MAX_CHUNKS,
                chunkSeconds));
      }
    }

    LOGGER.info(
        "Planned {} chunks: chunkDuration={}s, totalDuration={}s",
        ranges.size(),
        chunkSeconds,
        totalSeconds);
    return ranges;
  }
}
