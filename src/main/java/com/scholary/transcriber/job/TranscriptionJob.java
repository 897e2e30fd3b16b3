package com.scholary.transcriber.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.time.Instant;
import java.util.Locale;

/**
 * Immutable snapshot of an async transcription job.
 *
 * <p>The store swaps whole snapshots, so a reader always sees one consistent state. {@link
 * #apply(JobEvent, Instant)} is the state machine: pending → processing → completed | failed,
 * progress never goes down, and a terminal job never changes again.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionJob(
    @JsonProperty("job_id") String id,
    JobStatus status,
    int progress,
    JobOptions options,
    TranscriptionResult result,
    JobError error,
    StorageInfo storage,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt) {

  /** Highest progress a job can report before it completes. */
  static final int MAX_RUNNING_PROGRESS = 99;

  public static TranscriptionJob pending(String id, JobOptions options, Instant createdAt) {
    return new TranscriptionJob(
        id, JobStatus.PENDING, 0, options, null, null, null, createdAt, null, null);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * Returns the snapshot after {@code event}, or this same instance when the event changes
   * nothing (a progress value lower than the current one).
   *
   * @throws InvalidStateException if the event is not allowed from the current status
   */
  public TranscriptionJob apply(JobEvent event, Instant now) {
    switch (event.type()) {
      case START:
        requireStatus(event, JobStatus.PENDING);
        return new TranscriptionJob(
            id, JobStatus.PROCESSING, progress, options, null, null, null, createdAt, now, null);
      case PROGRESS:
        requireStatus(event, JobStatus.PROCESSING);
        int clamped = Math.max(0, Math.min(MAX_RUNNING_PROGRESS, event.progress()));
        if (clamped <= progress) {
          return this;
        }
        return new TranscriptionJob(
            id, status, clamped, options, null, null, null, createdAt, startedAt, null);
      case COMPLETE:
        requireStatus(event, JobStatus.PROCESSING);
        return new TranscriptionJob(
            id,
            JobStatus.COMPLETED,
            100,
            options,
            event.result(),
            null,
            event.storage(),
            createdAt,
            startedAt,
            now);
      case FAIL:
        requireStatus(event, JobStatus.PROCESSING);
        return new TranscriptionJob(
            id,
            JobStatus.FAILED,
            progress,
            options,
            null,
            event.error(),
            null,
            createdAt,
            startedAt,
            now);
      default:
        throw new IllegalArgumentException("Unknown event type: " + event.type());
    }
  }

  private void requireStatus(JobEvent event, JobStatus expected) {
    if (status != expected) {
      throw new InvalidStateException(
          String.format(
              "Cannot apply %s to job %s in status %s",
              event.type().name().toLowerCase(Locale.ROOT), id, status.value()));
    }
  }
}
