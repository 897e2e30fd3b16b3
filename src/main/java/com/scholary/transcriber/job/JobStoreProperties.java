package com.scholary.transcriber.job;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention of finished jobs, bound to {@code jobstore.*}.
 *
 * @param maxTerminalJobs how many completed or failed jobs are kept at most
 * @param retainTerminalMinutes how long a finished job stays readable after its last write
 */
@ConfigurationProperties(prefix = "jobstore")
@Validated
public record JobStoreProperties(
    @Positive int maxTerminalJobs, @Positive int retainTerminalMinutes) {

  public static JobStoreProperties defaults() {
    return new JobStoreProperties(1000, 60);
  }
}
