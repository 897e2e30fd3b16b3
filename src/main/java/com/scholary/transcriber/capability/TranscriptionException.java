package com.scholary.transcriber.capability;

import com.scholary.transcriber.error.ErrorKind;

public class TranscriptionException extends CapabilityException {

  public TranscriptionException(String message, String details, boolean transientFailure) {
    this(message, details, transientFailure, null);
  }

  public TranscriptionException(
      String message, String details, boolean transientFailure, Throwable cause) {
    super(ErrorKind.TRANSCRIPTION_ERROR, message, details, transientFailure, cause);
  }
}
