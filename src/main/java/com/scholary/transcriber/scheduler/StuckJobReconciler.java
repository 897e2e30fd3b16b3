package com.scholary.transcriber.scheduler;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.job.InvalidStateException;
import com.scholary.transcriber.job.JobError;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.TranscriptionJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails processing jobs that no worker is attending, or that have been processing
 * longer than {@code scheduler.stuckJobTimeoutMinutes}.
 */
@Component
public class StuckJobReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(StuckJobReconciler.class);

  private final JobStore jobStore;
  private final JobScheduler scheduler;
  private final Duration timeout;
  private final Clock clock;

  @Autowired
  public StuckJobReconciler(
      JobStore jobStore, JobScheduler scheduler, SchedulerProperties properties) {
    this(jobStore, scheduler, properties, Clock.systemUTC());
  }

  StuckJobReconciler(
      JobStore jobStore, JobScheduler scheduler, SchedulerProperties properties, Clock clock) {
    this.jobStore = jobStore;
    this.scheduler = scheduler;
    this.timeout = Duration.ofMinutes(properties.stuckJobTimeoutMinutes());
    this.clock = clock;
  }

  /** Returns the number of jobs failed by this run. */
  @Scheduled(
      initialDelayString = "${scheduler.reconcile-interval-ms:60000}",
      fixedDelayString = "${scheduler.reconcile-interval-ms:60000}")
  public int reconcile() {
    Instant now = clock.instant();
    int failed = 0;
    for (TranscriptionJob job : jobStore.findByStatus(JobStatus.PROCESSING)) {
      if (!scheduler.isAttended(job.id())) {
        LOGGER.warn("Job {} is processing without a worker, failing it", job.id());
        scheduler.failJob(
            job.id(), JobError.of(ErrorKind.INTERNAL_ERROR, "Job was abandoned by its worker"));
        failed++;
      } else if (job.startedAt() != null
          && Duration.between(job.startedAt(), now).compareTo(timeout) > 0) {
        LOGGER.warn(
            "Job {} has been processing since {}, longer than {}",
            job.id(),
            job.startedAt(),
            timeout);
        try {
          scheduler.cancel(job.id());
        } catch (InvalidStateException e) {
          // finished in the meantime
          continue;
        }
        scheduler.failJob(
            job.id(),
            JobError.of(
                ErrorKind.INTERNAL_ERROR,
                "Job exceeded the processing time limit of " + timeout.toMinutes() + " minutes"));
        failed++;
      }
    }
    if (failed > 0) {
      LOGGER.info("Reconciler failed {} stuck jobs", failed);
    }
    return failed;
  }
}
