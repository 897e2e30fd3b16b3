package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.job.JobStatus;

/** Returned with 202 when an upload was accepted and queued. */
public record JobCreateResponse(
    @JsonProperty("job_id") String jobId, JobStatus status, String message) {

  static final String QUEUED_MESSAGE = "Transcription job created and queued for processing";
}
