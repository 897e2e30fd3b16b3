package com.scholary.transcriber.scheduler;

import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.JobEvent;

/** The work a worker does for one job once it is processing. */
@FunctionalInterface
public interface JobRunner {

  /**
   * Process a job and return the event that completes it.
   *
   * @throws com.scholary.transcriber.job.JobCanceledException if {@code token} was cancelled
   * @throws com.scholary.transcriber.error.TranscriberException for failures with a known code
   */
  JobEvent run(String jobId, CancellationToken token);
}
