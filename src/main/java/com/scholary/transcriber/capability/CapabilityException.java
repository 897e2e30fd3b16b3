package com.scholary.transcriber.capability;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/**
 * A failed call to a loaded capability.
 *
 * <p>{@link #isTransient()} tells the caller whether one more attempt could succeed: I/O errors,
 * timeouts and HTTP 429/5xx are transient, a rejected request or unreadable response is not.
 */
public abstract class CapabilityException extends TranscriberException {

  private final boolean transientFailure;

  protected CapabilityException(
      ErrorKind kind, String message, String details, boolean transientFailure, Throwable cause) {
    super(kind, message, details, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }

  /** HTTP statuses worth a retry. */
  public static boolean isTransientStatus(int statusCode) {
    return statusCode == 429 || statusCode >= 500;
  }
}
