package com.scholary.transcriber.error;

/**
 * Stable error codes exposed to clients.
 *
 * <p>Capability and I/O failures are always translated into one of these before they reach a job
 * record or an HTTP response.
 */
public enum ErrorKind {
  VALIDATION_ERROR,
  AUDIO_PROCESSING_ERROR,
  MODEL_LOAD_ERROR,
  TRANSCRIPTION_ERROR,
  DIARIZATION_ERROR,
  TRANSLATION_ERROR,
  CANCELED,
  INTERNAL_ERROR,
  INVALID_STATE,
  JOB_NOT_FOUND;

  public String code() {
    return name();
  }
}
