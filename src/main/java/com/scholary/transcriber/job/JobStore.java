package com.scholary.transcriber.job;

import com.scholary.transcriber.audio.AudioAsset;
import com.scholary.transcriber.audio.StagedUpload;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative record of every job.
 *
 * <p>All reads return immutable snapshots. Mutations are atomic per job; the worker that owns a
 * job is its only writer, readers may be anywhere.
 */
public interface JobStore {

  /** Create a pending job that owns {@code upload}. Returns the new id. */
  String create(JobOptions options, StagedUpload upload);

  /**
   * Apply an event and return the resulting snapshot.
   *
   * @throws JobNotFoundException if the id is unknown
   * @throws InvalidStateException if the event is not allowed from the job's status
   */
  TranscriptionJob transition(String jobId, JobEvent event);

  /** @throws JobNotFoundException if the id is unknown */
  TranscriptionJob get(String jobId);

  Optional<TranscriptionJob> find(String jobId);

  /** @throws JobNotFoundException if the id is unknown */
  StagedUpload upload(String jobId);

  /**
   * Record the normalized audio a running job produced, so deleting or evicting the job removes
   * it.
   *
   * @throws InvalidStateException if the job is already terminal
   */
  void attachAsset(String jobId, AudioAsset asset);

  /**
   * Remove a finished job and its files.
   *
   * @throws InvalidStateException if the job is still pending or processing
   */
  void delete(String jobId);

  /** Jobs in {@code status}, oldest first. */
  List<TranscriptionJob> findByStatus(JobStatus status);

  Map<JobStatus, Long> countByStatus();

  void addListener(JobListener listener);
}
