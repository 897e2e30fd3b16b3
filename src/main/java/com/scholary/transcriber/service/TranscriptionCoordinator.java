package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioAsset;
import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.capability.CapabilityRegistry;
import com.scholary.transcriber.capability.TranscriberOutput;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.JobOptions;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.transcript.DiarizationMerger;
import com.scholary.transcriber.transcript.SegmentSequences;
import com.scholary.transcriber.transcript.SpeakerTurn;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Produces the transcript of a prepared asset.
 *
 * <p>Speech recognition runs once per chunk; chunk-local timestamps are shifted by the chunk's
 * offset, the sequences are concatenated and renumbered from 0. When diarization is requested it
 * runs once on the whole normalized file and its turns are merged into the segments.
 *
 * <p>Recognition failures fail the job. Diarization failures degrade it: the transcript comes back
 * without speakers and with a warning. Failing to load either model fails the job.
 *
 * <p>Progress milestones: chunks move the job from 10 to 90 (10 to 70 with diarization), then 80
 * after diarization and 90 after the merge.
 */
@Component
public class TranscriptionCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionCoordinator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int PROGRESS_PREPARED = 10;
  static final int PROGRESS_TRANSCRIBED = 90;
  static final int PROGRESS_TRANSCRIBED_BEFORE_DIARIZATION = 70;
  static final int PROGRESS_DIARIZED = 80;
  static final int PROGRESS_MERGED = 90;

  static final String UNKNOWN_LANGUAGE = "unknown";
  static final String DIARIZATION_WARNING_PREFIX = "Speaker diarization failed: ";

  private final CapabilityRegistry registry;
  private final CapabilityInvoker invoker;
  private final DiarizationMerger merger;

  public TranscriptionCoordinator(
      CapabilityRegistry registry, CapabilityInvoker invoker, DiarizationMerger merger) {
    this.registry = registry;
    this.invoker = invoker;
    this.merger = merger;
  }

  /**
   * @param progress receives milestone percentages; values never decrease
   * @throws com.scholary.transcriber.capability.TranscriptionException if recognition fails
   * @throws com.scholary.transcriber.capability.ModelLoadException if a model cannot be loaded
   * @throws com.scholary.transcriber.job.JobCanceledException if the token is cancelled
   */
  public TranscriptionResult transcribe(
      AudioAsset asset, JobOptions options, CancellationToken token, IntConsumer progress) {

    int transcribedProgress =
        options.enableDiarization()
            ? PROGRESS_TRANSCRIBED_BEFORE_DIARIZATION
            : PROGRESS_TRANSCRIBED;

    List<AudioChunk> chunks = asset.chunks();
    List<TranscriptSegment> collected = new ArrayList<>();
    String detectedLanguage = null;

    for (AudioChunk chunk : chunks) {
      STRUCTURED_LOGGER.logChunkStarted(
          chunk.index(), chunks.size(), chunk.offsetSeconds(), chunk.durationSeconds());
      long startMs = System.currentTimeMillis();

      TranscriberOutput output =
          invoker
              .invoke(
                  "transcription",
                  () -> registry.transcriber(options.modelSize()),
                  transcriber -> transcriber.transcribe(chunk.path(), options.language()),
                  false,
                  token)
              .valueOrThrow();

      for (TranscriptSegment segment : output.segments()) {
        collected.add(segment.shifted(chunk.offsetSeconds()));
      }
      if (detectedLanguage == null && output.language() != null && !output.language().isBlank()) {
        detectedLanguage = output.language();
      }

      STRUCTURED_LOGGER.logChunkFinished(
          chunk.index(), output.segments().size(), System.currentTimeMillis() - startMs);
      progress.accept(
          PROGRESS_PREPARED
              + (transcribedProgress - PROGRESS_PREPARED) * (chunk.index() + 1) / chunks.size());
    }

    List<TranscriptSegment> segments = SegmentSequences.normalize(collected);
    List<String> warnings = new ArrayList<>();

    if (options.enableDiarization()) {
      CapabilityOutcome<List<SpeakerTurn>> diarization =
          invoker.invoke(
              "diarization",
              registry::diarizer,
              diarizer -> diarizer.diarize(asset.normalizedPath(), options.numSpeakers()),
              true,
              token);
      List<SpeakerTurn> turns = diarization.valueOrThrow();
      progress.accept(PROGRESS_DIARIZED);

      if (diarization.isOk()) {
        segments = merger.merge(segments, turns);
      } else {
        String reason =
            diarization.error().getDetails() != null
                ? diarization.error().getDetails()
                : diarization.error().getMessage();
        warnings.add(DIARIZATION_WARNING_PREFIX + reason);
      }
      progress.accept(PROGRESS_MERGED);
    }

    SegmentSequences.validate(segments);

    String language = firstNonBlank(options.language(), detectedLanguage, UNKNOWN_LANGUAGE);
    TranscriptionResult result =
        TranscriptionResult.of(segments, language, asset.durationSeconds(), warnings);
    LOGGER.info(
        "Transcript ready: segments={}, language={}, duration={}s, warnings={}",
        segments.size(),
        language,
        asset.durationSeconds(),
        warnings.size());
    return result;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
