package com.scholary.transcriber.scheduler;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker pool settings, bound to {@code scheduler.*}.
 *
 * @param maxConcurrentJobs number of jobs processed at once; the rest wait in FIFO order
 * @param queueCapacity how many jobs may wait, unbounded by default; a submission beyond it
 *     fails the job
 * @param stuckJobTimeoutMinutes processing time after which a job is failed by the reconciler
 * @param reconcileIntervalMs delay between two reconciler runs
 */
@ConfigurationProperties(prefix = "scheduler")
@Validated
public record SchedulerProperties(
    @Positive int maxConcurrentJobs,
    @Positive int queueCapacity,
    @Positive long stuckJobTimeoutMinutes,
    @Positive long reconcileIntervalMs) {

  public static SchedulerProperties defaults() {
    return new SchedulerProperties(3, Integer.MAX_VALUE, 120, 60_000);
  }
}
