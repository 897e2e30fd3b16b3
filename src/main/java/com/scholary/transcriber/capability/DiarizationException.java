package com.scholary.transcriber.capability;

import com.scholary.transcriber.error.ErrorKind;

public class DiarizationException extends CapabilityException {

  public DiarizationException(String message, String details, boolean transientFailure) {
    this(message, details, transientFailure, null);
  }

  public DiarizationException(
      String message, String details, boolean transientFailure, Throwable cause) {
    super(ErrorKind.DIARIZATION_ERROR, message, details, transientFailure, cause);
  }
}
