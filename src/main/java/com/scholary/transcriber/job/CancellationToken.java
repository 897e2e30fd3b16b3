package com.scholary.transcriber.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a job's worker and whoever cancels it.
 *
 * <p>Nothing is interrupted: the worker calls {@link #throwIfCancelled()} between chunks and
 * around every capability call.
 */
public final class CancellationToken {

  private final String jobId;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public CancellationToken(String jobId) {
    this.jobId = jobId;
  }

  /** A token nobody will ever cancel. */
  public static CancellationToken none() {
    return new CancellationToken(null);
  }

  public String jobId() {
    return jobId;
  }

  /** Returns true if this call flipped the flag. */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new JobCanceledException(jobId);
    }
  }
}
