package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioAsset;
import com.scholary.transcriber.audio.AudioPreprocessor;
import com.scholary.transcriber.audio.StagedUpload;
import com.scholary.transcriber.export.TranscriptArchiver;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.JobEvent;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.StorageInfo;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.scheduler.JobRunner;
import com.scholary.transcriber.transcript.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * What a worker does for one transcription job: prepare the audio, transcribe it, archive the
 * result when object storage is enabled.
 *
 * <p>Reports progress 5 once running and 10 once the audio is prepared; the coordinator reports
 * the rest. The normalized audio is released when the job ends, whatever the outcome.
 */
@Service
public class TranscriptionPipeline implements JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);

  static final int PROGRESS_STARTED = 5;

  static final String ARCHIVE_WARNING_PREFIX = "Transcript archiving failed: ";

  private final JobStore jobStore;
  private final AudioPreprocessor preprocessor;
  private final TranscriptionCoordinator coordinator;
  private final TranscriptArchiver archiver;

  public TranscriptionPipeline(
      JobStore jobStore,
      AudioPreprocessor preprocessor,
      TranscriptionCoordinator coordinator,
      TranscriptArchiver archiver) {
    this.jobStore = jobStore;
    this.preprocessor = preprocessor;
    this.coordinator = coordinator;
    this.archiver = archiver;
  }

  @Override
  public JobEvent run(String jobId, CancellationToken token) {
    TranscriptionJob job = jobStore.get(jobId);
    StagedUpload upload = jobStore.upload(jobId);
    LOGGER.info(
        "Processing job {}: file={}, options={}", jobId, upload.originalName(), job.options());
    progress(jobId, PROGRESS_STARTED);

    AudioAsset asset = null;
    try {
      asset = preprocessor.prepare(upload, token);
      jobStore.attachAsset(jobId, asset);
      progress(jobId, TranscriptionCoordinator.PROGRESS_PREPARED);

      TranscriptionResult result =
          coordinator.transcribe(asset, job.options(), token, percent -> progress(jobId, percent));
      token.throwIfCancelled();

      StorageInfo storage = null;
      if (archiver.isEnabled()) {
        try {
          storage = archiver.archive(jobId, result);
        } catch (ObjectStoreException e) {
          LOGGER.warn("Archiving job {} failed: {}", jobId, e.getMessage());
          result = result.withWarning(ARCHIVE_WARNING_PREFIX + e.getMessage());
        }
      }
      return JobEvent.complete(result, storage);

    } finally {
      preprocessor.release(asset);
    }
  }

  private void progress(String jobId, int percent) {
    jobStore.transition(jobId, JobEvent.progress(percent));
  }
}
