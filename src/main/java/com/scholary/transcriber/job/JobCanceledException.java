package com.scholary.transcriber.job;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

public class JobCanceledException extends TranscriberException {

  public JobCanceledException(String jobId) {
    super(ErrorKind.CANCELED, "Job was cancelled" + (jobId == null ? "" : ": " + jobId));
  }
}
