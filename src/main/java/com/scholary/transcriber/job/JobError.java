package com.scholary.transcriber.job;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/** Error attached to a failed job: a stable code plus a message meant for people. */
public record JobError(String code, String message) {

  public static JobError of(ErrorKind kind, String message) {
    return new JobError(kind.code(), message);
  }

  public static JobError from(TranscriberException e) {
    return new JobError(e.getKind().code(), e.getMessage());
  }
}
