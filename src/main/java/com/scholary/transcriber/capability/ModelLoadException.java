package com.scholary.transcriber.capability;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/**
 * A capability could not be initialized. Never retried; the registry remembers it per key.
 */
public class ModelLoadException extends TranscriberException {

  private final CapabilityKey key;

  public ModelLoadException(CapabilityKey key, String message, String details) {
    this(key, message, details, null);
  }

  public ModelLoadException(
      CapabilityKey key, String message, String details, Throwable cause) {
    super(ErrorKind.MODEL_LOAD_ERROR, message, details, cause);
    this.key = key;
  }

  public CapabilityKey getKey() {
    return key;
  }
}
