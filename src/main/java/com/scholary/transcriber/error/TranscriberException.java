package com.scholary.transcriber.error;

/**
 * Base exception for every failure the service reports by code.
 *
 * <p>Unchecked, like the object store and Whisper exceptions: callers either translate it into a
 * job failure or let the API exception handler turn it into a response. The {@code details}
 * string is for logs and the error body; it must never carry a stack trace.
 */
public class TranscriberException extends RuntimeException {

  private final ErrorKind kind;
  private final String details;

  public TranscriberException(ErrorKind kind, String message) {
    this(kind, message, null, null);
  }

  public TranscriberException(ErrorKind kind, String message, String details) {
    this(kind, message, details, null);
  }

  public TranscriberException(ErrorKind kind, String message, String details, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.details = details;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getDetails() {
    return details;
  }
}
