package com.scholary.transcriber.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: archiving is best effort, and the one caller that cares turns it into a warning.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
