package com.scholary.transcriber.job;

import com.scholary.transcriber.transcript.TranscriptionResult;
import java.util.Objects;

/**
 * A requested change to a job. Build one with the static factories; {@link
 * TranscriptionJob#apply} decides whether it is legal.
 */
public record JobEvent(
    Type type, int progress, TranscriptionResult result, StorageInfo storage, JobError error) {

  public enum Type {
    START,
    PROGRESS,
    COMPLETE,
    FAIL
  }

  public static JobEvent start() {
    return new JobEvent(Type.START, 0, null, null, null);
  }

  public static JobEvent progress(int percent) {
    return new JobEvent(Type.PROGRESS, percent, null, null, null);
  }

  public static JobEvent complete(TranscriptionResult result) {
    return complete(result, null);
  }

  public static JobEvent complete(TranscriptionResult result, StorageInfo storage) {
    return new JobEvent(
        Type.COMPLETE, 100, Objects.requireNonNull(result, "result"), storage, null);
  }

  public static JobEvent fail(JobError error) {
    return new JobEvent(Type.FAIL, 0, null, null, Objects.requireNonNull(error, "error"));
  }
}
