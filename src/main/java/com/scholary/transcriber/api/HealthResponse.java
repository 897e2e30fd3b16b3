package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Service health.
 *
 * @param status {@code healthy} when transcription is ready, {@code degraded} otherwise
 * @param services readiness per capability: {@code ready}, {@code disabled} or {@code failed}
 */
public record HealthResponse(
    String status, Map<String, String> services, String version, Queue queue) {

  public record Queue(
      int active,
      int queued,
      @JsonProperty("max_concurrent_jobs") int maxConcurrentJobs,
      Map<String, Long> jobs) {}
}
