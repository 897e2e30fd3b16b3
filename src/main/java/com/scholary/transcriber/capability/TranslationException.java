package com.scholary.transcriber.capability;

import com.scholary.transcriber.error.ErrorKind;

public class TranslationException extends CapabilityException {

  public TranslationException(String message, String details, boolean transientFailure) {
    this(message, details, transientFailure, null);
  }

  public TranslationException(
      String message, String details, boolean transientFailure, Throwable cause) {
    super(ErrorKind.TRANSLATION_ERROR, message, details, transientFailure, cause);
  }
}
