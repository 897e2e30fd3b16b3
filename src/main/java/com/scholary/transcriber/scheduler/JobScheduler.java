package com.scholary.transcriber.scheduler;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.InvalidStateException;
import com.scholary.transcriber.job.JobError;
import com.scholary.transcriber.job.JobEvent;
import com.scholary.transcriber.job.JobNotFoundException;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.logging.StructuredLogger;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs jobs on a fixed pool of workers fed by one FIFO queue.
 *
 * <p>At most {@code scheduler.maxConcurrentJobs} jobs are processing at any time; the others stay
 * pending in the executor's queue. Each worker is the only writer of its job and always ends it
 * with {@code complete} or {@code fail}, whatever the pipeline throws.
 *
 * <p>Cancellation is cooperative: {@link #cancel(String)} flips the job's token and the pipeline
 * notices at its next checkpoint. A job cancelled while still queued is failed as soon as a
 * worker picks it up.
 */
@Component
public class JobScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobScheduler.class);

  static final String INTERNAL_ERROR_MESSAGE = "Internal error while processing job";

  private final JobStore jobStore;
  private final JobRunner jobRunner;
  private final ThreadPoolTaskExecutor executor;

  /** Tokens of queued and running jobs. */
  private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

  /** Jobs a worker is attending, with the time the worker picked them up. */
  private final Map<String, Instant> running = new ConcurrentHashMap<>();

  public JobScheduler(
      JobStore jobStore,
      JobRunner jobRunner,
      @Qualifier("jobExecutor") ThreadPoolTaskExecutor executor) {
    this.jobStore = jobStore;
    this.jobRunner = jobRunner;
    this.executor = executor;
  }

  /** Queue a pending job. Returns immediately. */
  public void submit(String jobId) {
    CancellationToken token = new CancellationToken(jobId);
    tokens.put(jobId, token);
    try {
      executor.execute(() -> runJob(jobId, token));
      LOGGER.info("Submitted job {} for processing", jobId);
    } catch (TaskRejectedException e) {
      tokens.remove(jobId);
      LOGGER.error("Job queue rejected job {}: {}", jobId, e.getMessage());
      failJob(jobId, JobError.of(ErrorKind.INTERNAL_ERROR, "Job queue is full"));
    }
  }

  /**
   * Request cancellation of a pending or processing job.
   *
   * @return the job's snapshot at the time of the request
   * @throws InvalidStateException if the job already finished
   * @throws JobNotFoundException if the id is unknown
   */
  public TranscriptionJob cancel(String jobId) {
    TranscriptionJob job = jobStore.get(jobId);
    if (job.isTerminal()) {
      throw new InvalidStateException(
          "Job " + jobId + " is already " + job.status().value() + " and cannot be cancelled");
    }

    CancellationToken token = tokens.get(jobId);
    if (token != null) {
      if (token.cancel()) {
        LOGGER.info("Cancellation requested for job {} ({})", jobId, job.status().value());
      }
    } else {
      // Nobody will ever pick this job up, so end it here.
      failJob(jobId, JobError.of(ErrorKind.CANCELED, "Job was cancelled"));
    }
    return jobStore.get(jobId);
  }

  public boolean isAttended(String jobId) {
    return running.containsKey(jobId);
  }

  public int activeCount() {
    return running.size();
  }

  public int queuedCount() {
    return executor.getThreadPoolExecutor().getQueue().size();
  }

  public int maxConcurrentJobs() {
    return executor.getMaxPoolSize();
  }

  /**
   * Drive a job that has no worker to {@code failed}, starting it first if it is still pending.
   * Does nothing when the job is gone or already finished.
   */
  public void failJob(String jobId, JobError error) {
    try {
      Optional<TranscriptionJob> current = jobStore.find(jobId);
      if (current.isEmpty() || current.get().isTerminal()) {
        return;
      }
      if (current.get().status() == JobStatus.PENDING) {
        jobStore.transition(jobId, JobEvent.start());
      }
      jobStore.transition(jobId, JobEvent.fail(error));
    } catch (InvalidStateException | JobNotFoundException e) {
      LOGGER.warn("Could not fail job {} with {}: {}", jobId, error.code(), e.getMessage());
    }
  }

  @PreDestroy
  void cancelAll() {
    tokens.values().forEach(CancellationToken::cancel);
  }

  private void runJob(String jobId, CancellationToken token) {
    StructuredLogger.setJobContext(jobId, null);
    running.put(jobId, Instant.now());
    try {
      token.throwIfCancelled();
      jobStore.transition(jobId, JobEvent.start());

      JobEvent completion = jobRunner.run(jobId, token);
      token.throwIfCancelled();
      jobStore.transition(jobId, completion);

    } catch (TranscriberException e) {
      LOGGER.warn("Job {} failed: code={}, message={}", jobId, e.getKind().code(), e.getMessage());
      failJob(jobId, JobError.from(e));

    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed unexpectedly", jobId, e);
      failJob(jobId, JobError.of(ErrorKind.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));

    } finally {
      running.remove(jobId);
      tokens.remove(jobId);
      StructuredLogger.clearJobContext();
    }
  }
}
