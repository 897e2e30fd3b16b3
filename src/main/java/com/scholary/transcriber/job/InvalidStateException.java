package com.scholary.transcriber.job;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/** An operation that the job's current status does not allow. */
public class InvalidStateException extends TranscriberException {

  public InvalidStateException(String message) {
    super(ErrorKind.INVALID_STATE, message);
  }
}
