package com.scholary.transcriber.audio;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/** The audio could not be decoded, resampled or cut. Fails the job. */
public class AudioProcessingException extends TranscriberException {

  public AudioProcessingException(String message, String details) {
    super(ErrorKind.AUDIO_PROCESSING_ERROR, message, details);
  }

  public AudioProcessingException(String message, String details, Throwable cause) {
    super(ErrorKind.AUDIO_PROCESSING_ERROR, message, details, cause);
  }
}
