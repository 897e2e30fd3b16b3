package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioPreprocessor;
import com.scholary.transcriber.audio.StagedUpload;
import com.scholary.transcriber.capability.CapabilityKind;
import com.scholary.transcriber.capability.CapabilityRegistry;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.job.JobOptions;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.scheduler.JobScheduler;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admission of new jobs.
 *
 * <p>Everything that can be rejected is rejected before the job exists: the file name and size,
 * the options, and capabilities that are disabled or already known to fail loading. Only then is
 * the upload written to disk, the job created and handed to the scheduler.
 */
@Service
public class JobSubmissionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobSubmissionService.class);

  private final AudioPreprocessor preprocessor;
  private final CapabilityRegistry registry;
  private final JobStore jobStore;
  private final JobScheduler scheduler;

  public JobSubmissionService(
      AudioPreprocessor preprocessor,
      CapabilityRegistry registry,
      JobStore jobStore,
      JobScheduler scheduler) {
    this.preprocessor = preprocessor;
    this.registry = registry;
    this.jobStore = jobStore;
    this.scheduler = scheduler;
  }

  /**
   * Admit one upload.
   *
   * @param fileName name the client declared for the file
   * @param sizeBytes declared size of the upload
   * @param content the file bytes; not closed here
   * @return the pending job, already queued
   * @throws ValidationException if the upload or options are rejected
   * @throws com.scholary.transcriber.capability.ModelLoadException if a required capability is
   *     disabled or failed to load before
   */
  public TranscriptionJob submit(
      String fileName, long sizeBytes, InputStream content, JobOptions options) {
    preprocessor.validate(fileName, sizeBytes);
    checkCapabilities(options);

    StagedUpload upload = preprocessor.stage(content, fileName);
    String jobId;
    try {
      jobId = jobStore.create(options, upload);
    } catch (RuntimeException e) {
      preprocessor.discard(upload);
      throw e;
    }

    LOGGER.info(
        "Created job {} for {} ({} bytes, model={}, diarization={})",
        jobId,
        upload.originalName(),
        upload.sizeBytes(),
        options.modelSize().value(),
        options.enableDiarization());
    // A free worker may start the job right away; the caller gets the snapshot it submitted.
    TranscriptionJob pending = jobStore.get(jobId);
    scheduler.submit(jobId);
    return pending;
  }

  private void checkCapabilities(JobOptions options) {
    if (options.enableDiarization() && !registry.isEnabled(CapabilityKind.DIARIZATION)) {
      throw new ValidationException(
          "Invalid parameters: speaker diarization is not available",
          "Submit the file with enable_diarization=false");
    }
    registry.ensureAvailable(registry.transcriberKey(options.modelSize()));
    if (options.enableDiarization()) {
      registry.ensureAvailable(registry.diarizerKey());
    }
  }
}
