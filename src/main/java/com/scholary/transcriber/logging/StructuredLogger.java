package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method logs one event type with its fields in the MDC so the lines can be filtered by
 * {@code event_type} and {@code jobId} in a log index. Event fields are removed again after the
 * line is written; the job context stays until {@link #clearJobContext()}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job state transition. */
  public void logJobTransition(String jobId, String from, String to, int progress) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromStatus", from);
      MDC.put("toStatus", to);
      MDC.put("progress", String.valueOf(progress));

      logger.info(
          "Job transition: jobId={}, {} -> {}, progress={}%", jobId, from, to, progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, int totalChunks, double offset, double duration) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("offset", String.valueOf(offset));
      MDC.put("durationSeconds", String.valueOf(duration));

      logger.debug(
          "Chunk started: index={}/{}, offset={}s, duration={}s",
          chunkIndex + 1,
          totalChunks,
          offset,
          duration);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, int segments, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("segments", String.valueOf(segments));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.debug(
          "Chunk finished: index={}, segments={}, transcribe={}ms",
          chunkIndex,
          segments,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a capability call that will be retried. */
  public void logCapabilityRetry(String capability, int attempt, String errorType, String message) {
    try {
      MDC.put("event_type", "capability_retry");
      MDC.put("capability", capability);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("errorType", errorType);

      logger.warn(
          "Capability retry: capability={}, attempt={}, error={}, message={}",
          capability,
          attempt,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a capability call that gave up. */
  public void logCapabilityFailed(
      String capability, int attempts, String errorType, String message, boolean degraded) {
    try {
      MDC.put("event_type", "capability_failed");
      MDC.put("capability", capability);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);
      MDC.put("degraded", String.valueOf(degraded));

      if (degraded) {
        logger.warn(
            "Capability degraded: capability={}, attempts={}, error={}, message={}",
            capability,
            attempts,
            errorType,
            message);
      } else {
        logger.error(
            "Capability failed: capability={}, attempts={}, error={}, message={}",
            capability,
            attempts,
            errorType,
            message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of merging speaker turns into segments. */
  public void logMergeSummary(
      int inputSegments, int turns, int outputSegments, int splits, long unlabeled) {
    try {
      MDC.put("event_type", "diarization_merge");
      MDC.put("segments", String.valueOf(outputSegments));
      MDC.put("splits", String.valueOf(splits));

      logger.info(
          "Diarization merge: segments={} -> {}, turns={}, splits={}, unlabeled={}",
          inputSegments,
          outputSegments,
          turns,
          splits,
          unlabeled);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String fileName) {
    MDC.put("jobId", jobId);
    if (fileName != null) {
      MDC.put("fileName", fileName);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("fileName");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("progress");
    MDC.remove("chunk_index");
    MDC.remove("offset");
    MDC.remove("durationSeconds");
    MDC.remove("segments");
    MDC.remove("transcribeMs");
    MDC.remove("capability");
    MDC.remove("attempt");
    MDC.remove("errorType");
    MDC.remove("degraded");
    MDC.remove("splits");
  }
}
