package com.scholary.transcriber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcriber.audio.AudioAsset;
import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.capability.CapabilityKey;
import com.scholary.transcriber.capability.CapabilityLoader;
import com.scholary.transcriber.capability.CapabilityRegistry;
import com.scholary.transcriber.capability.DiarizationException;
import com.scholary.transcriber.capability.Diarizer;
import com.scholary.transcriber.capability.ModelLoadException;
import com.scholary.transcriber.capability.Transcriber;
import com.scholary.transcriber.capability.TranscriberOutput;
import com.scholary.transcriber.capability.TranscriptionException;
import com.scholary.transcriber.capability.Translator;
import com.scholary.transcriber.capability.diarization.DiarizationProperties;
import com.scholary.transcriber.capability.translation.TranslationProperties;
import com.scholary.transcriber.capability.whisper.WhisperProperties;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.JobCanceledException;
import com.scholary.transcriber.job.JobOptions;
import com.scholary.transcriber.job.ModelSize;
import com.scholary.transcriber.transcript.DiarizationMerger;
import com.scholary.transcriber.transcript.MergeProperties;
import com.scholary.transcriber.transcript.SpeakerTurn;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptionCoordinatorTest {

  private static final Path NORMALIZED = Path.of("/work/job/normalized.wav");

  private final AtomicInteger transcriberCalls = new AtomicInteger();
  private final AtomicInteger diarizerCalls = new AtomicInteger();
  private final List<Integer> progress = new ArrayList<>();

  private Transcriber transcriber;
  private Diarizer diarizer;
  private boolean diarizerLoadFails;
  private TranscriptionCoordinator coordinator;

  @BeforeEach
  void setUp() {
    transcriber =
        (audio, hint) ->
            new TranscriberOutput(
                List.of(new TranscriptSegment(3, "words in " + audio.getFileName(), 1.0, 2.0, 0.9)),
                "en",
                2.0);
    diarizer = (audio, speakers) -> List.of(new SpeakerTurn(0.0, 1000.0, "SPEAKER_00"));

    CapabilityLoader loader =
        new CapabilityLoader() {
          @Override
          public Transcriber loadTranscriber(CapabilityKey key) {
            return (audio, hint) -> {
              transcriberCalls.incrementAndGet();
              return transcriber.transcribe(audio, hint);
            };
          }

          @Override
          public Diarizer loadDiarizer(CapabilityKey key) {
            if (diarizerLoadFails) {
              throw new ModelLoadException(
                  key, "Pyannote authentication token not configured", null);
            }
            return (audio, speakers) -> {
              diarizerCalls.incrementAndGet();
              return diarizer.diarize(audio, speakers);
            };
          }

          @Override
          public Translator loadTranslator(CapabilityKey key) {
            throw new UnsupportedOperationException();
          }
        };
    CapabilityRegistry registry =
        new CapabilityRegistry(
            loader,
            new WhisperProperties(true, "http://w", 5, 60, "base", "cpu", "int8", 5, true, false),
            new DiarizationProperties(true, "http://d", 5, 60, "pyannote", "cpu", "t", false),
            new TranslationProperties(false, "http://t", 5, 60, "nllb", "cpu", false));
    coordinator =
        new TranscriptionCoordinator(
            registry,
            new CapabilityInvoker(0),
            new DiarizationMerger(MergeProperties.defaults()));
  }

  @Test
  void transcribe_shouldShiftChunkTimestampsAndRenumber() {
    TranscriptionResult result =
        run(chunkedAsset(), options(null, false), CancellationToken.none());

    assertThat(result.segments()).extracting(TranscriptSegment::start).containsExactly(1.0, 301.0);
    assertThat(result.segments()).extracting(TranscriptSegment::id).containsExactly(0, 1);
    assertThat(result.text()).isEqualTo("words in chunk_000.wav words in chunk_001.wav");
    assertThat(result.language()).isEqualTo("en");
    assertThat(result.duration()).isEqualTo(600.0);
    assertThat(result.warnings()).isEmpty();
    assertThat(progress).containsExactly(50, 90);
  }

  @Test
  void transcribe_shouldPreferLanguageHint() {
    TranscriptionResult result = run(singleAsset(), options("es", false), CancellationToken.none());

    assertThat(result.language()).isEqualTo("es");
  }

  @Test
  void transcribe_shouldReportUnknownLanguageWhenNoneDetected() {
    transcriber =
        (audio, hint) ->
            new TranscriberOutput(List.of(new TranscriptSegment(0, "hm", 0.0, 1.0, 0.5)), null, 1);

    TranscriptionResult result = run(singleAsset(), options(null, false), CancellationToken.none());

    assertThat(result.language()).isEqualTo("unknown");
  }

  @Test
  void transcribe_shouldCompleteSilentAudioWithEmptyTranscript() {
    transcriber = (audio, hint) -> new TranscriberOutput(List.of(), null, 0.0);

    TranscriptionResult result = run(singleAsset(), options(null, false), CancellationToken.none());

    assertThat(result.segments()).isEmpty();
    assertThat(result.text()).isEmpty();
    assertThat(result.duration()).isEqualTo(10.0);
  }

  @Test
  void transcribe_shouldMergeSpeakersWhenDiarizationRequested() {
    TranscriptionResult result = run(singleAsset(), options(null, true), CancellationToken.none());

    assertThat(result.segments()).allMatch(s -> "SPEAKER_00".equals(s.speaker()));
    assertThat(result.hasSpeakers()).isTrue();
    assertThat(progress).containsExactly(70, 80, 90);
    assertThat(diarizerCalls.get()).isEqualTo(1);
  }

  @Test
  void transcribe_shouldDegradeWhenDiarizationFails() {
    diarizer =
        (audio, speakers) -> {
          throw new DiarizationException("Speaker diarization failed", "pyannote crashed", false);
        };

    TranscriptionResult result = run(singleAsset(), options(null, true), CancellationToken.none());

    assertThat(result.segments()).isNotEmpty().allMatch(s -> s.speaker() == null);
    assertThat(result.warnings()).containsExactly("Speaker diarization failed: pyannote crashed");
    assertThat(diarizerCalls.get()).isEqualTo(1);
    assertThat(progress).containsExactly(70, 80, 90);
  }

  @Test
  void transcribe_shouldRetryTransientDiarizationFailureOnce() {
    AtomicInteger attempts = new AtomicInteger();
    diarizer =
        (audio, speakers) -> {
          if (attempts.incrementAndGet() == 1) {
            throw new DiarizationException("Speaker diarization failed", "HTTP 503", true);
          }
          return List.of(new SpeakerTurn(0.0, 10.0, "SPEAKER_01"));
        };

    TranscriptionResult result = run(singleAsset(), options(null, true), CancellationToken.none());

    assertThat(diarizerCalls.get()).isEqualTo(2);
    assertThat(result.segments()).allMatch(s -> "SPEAKER_01".equals(s.speaker()));
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  void transcribe_shouldFailWhenDiarizerCannotLoad() {
    diarizerLoadFails = true;

    assertThatThrownBy(
            () -> run(singleAsset(), options(null, true), CancellationToken.none()))
        .isInstanceOf(ModelLoadException.class)
        .hasMessageContaining("token");
  }

  @Test
  void transcribe_shouldFailAfterSecondTransientRecognitionError() {
    transcriber =
        (audio, hint) -> {
          throw new TranscriptionException("Failed to transcribe audio file", "timeout", true);
        };

    assertThatThrownBy(
            () -> run(singleAsset(), options(null, false), CancellationToken.none()))
        .isInstanceOf(TranscriptionException.class);
    assertThat(transcriberCalls.get()).isEqualTo(2);
  }

  @Test
  void transcribe_shouldNotRetryPermanentRecognitionError() {
    transcriber =
        (audio, hint) -> {
          throw new TranscriptionException("Failed to transcribe audio file", "HTTP 400", false);
        };

    assertThatThrownBy(
            () -> run(singleAsset(), options(null, false), CancellationToken.none()))
        .isInstanceOf(TranscriptionException.class);
    assertThat(transcriberCalls.get()).isEqualTo(1);
  }

  @Test
  void transcribe_shouldStopWhenCancelled() {
    CancellationToken token = new CancellationToken("job-1");
    token.cancel();

    assertThatThrownBy(() -> run(chunkedAsset(), options(null, false), token))
        .isInstanceOf(JobCanceledException.class);
    assertThat(transcriberCalls.get()).isZero();
  }

  private TranscriptionResult run(AudioAsset asset, JobOptions options, CancellationToken token) {
    return coordinator.transcribe(asset, options, token, progress::add);
  }

  private static JobOptions options(String language, boolean diarize) {
    return new JobOptions(language, ModelSize.BASE, diarize, null);
  }

  private static AudioAsset singleAsset() {
    return new AudioAsset(
        NORMALIZED,
        NORMALIZED.getParent(),
        10.0,
        16000,
        1,
        "mp3",
        List.of(new AudioChunk(0, NORMALIZED, 0.0, 10.0)));
  }

  private static AudioAsset chunkedAsset() {
    return new AudioAsset(
        NORMALIZED,
        NORMALIZED.getParent(),
        600.0,
        16000,
        1,
        "mp3",
        List.of(
            new AudioChunk(0, NORMALIZED.resolveSibling("chunk_000.wav"), 0.0, 300.0),
            new AudioChunk(1, NORMALIZED.resolveSibling("chunk_001.wav"), 300.0, 300.0)));
  }
}
