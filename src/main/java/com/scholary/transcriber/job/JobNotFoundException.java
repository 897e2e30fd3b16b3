package com.scholary.transcriber.job;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

public class JobNotFoundException extends TranscriberException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super(ErrorKind.JOB_NOT_FOUND, "Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
