package com.scholary.transcriber.capability.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scholary.transcriber.capability.CapabilityKey;
import com.scholary.transcriber.capability.ModelServerClient;
import com.scholary.transcriber.capability.ModelServerResponseException;
import com.scholary.transcriber.capability.MultipartBody;
import com.scholary.transcriber.capability.Transcriber;
import com.scholary.transcriber.capability.TranscriberOutput;
import com.scholary.transcriber.capability.TranscriptionException;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.Word;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the faster-whisper transcription API, bound to one loaded model.
 *
 * <p>Makes exactly one request per call. Retrying is the coordinator's decision, so a failure is
 * reported as a {@link TranscriptionException} flagged transient or not.
 */
public class WhisperClient implements Transcriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final ModelServerClient server;
  private final CapabilityKey key;
  private final WhisperProperties properties;

  public WhisperClient(ModelServerClient server, CapabilityKey key, WhisperProperties properties) {
    this.server = server;
    this.key = key;
    this.properties = properties;
  }

  @Override
  public TranscriberOutput transcribe(Path audio, String languageHint) {
    LOGGER.info(
        "Transcribing: file={}, model={}, language={}",
        audio.getFileName(),
        key.model(),
        languageHint);

    WhisperResponse response;
    try {
      MultipartBody body =
          new MultipartBody()
              .file("file", audio, "audio/wav")
              .field("model", key.model())
              .field("language", languageHint)
              .field("beam_size", properties.beamSize())
              .field("vad_filter", properties.vadFilter())
              .field("word_timestamps", true);
      response = server.postMultipart("/api/v1/transcribe", body, WhisperResponse.class);
    } catch (JsonProcessingException e) {
      throw new TranscriptionException(
          "Failed to transcribe audio file",
          "Unreadable Whisper response: " + e.getOriginalMessage(),
          false,
          e);
    } catch (ModelServerResponseException e) {
      throw new TranscriptionException(
          "Failed to transcribe audio file", e.getMessage(), e.isTransient(), e);
    } catch (IOException e) {
      throw new TranscriptionException("Failed to transcribe audio file", e.getMessage(), true, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription interrupted", e.getMessage(), false, e);
    }

    if (response == null) {
      throw new TranscriptionException(
          "Failed to transcribe audio file", "Empty Whisper response", false);
    }

    TranscriberOutput output = toOutput(response, languageHint);
    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        output.segments().size(),
        output.language());
    return output;
  }

  /** Map the wire format onto transcript segments with confidences in [0, 1]. */
  static TranscriberOutput toOutput(WhisperResponse response, String languageHint) {
    List<WhisperResponse.Segment> raw =
        response.segments() == null ? List.of() : response.segments();
    List<TranscriptSegment> segments = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      WhisperResponse.Segment s = raw.get(i);
      List<Word> words = new ArrayList<>();
      if (s.words() != null) {
        for (WhisperResponse.WordTiming w : s.words()) {
          String text = w.word() == null ? "" : w.word().trim();
          words.add(new Word(text, w.start(), w.end(), clamp(w.probability(), 1.0)));
        }
      }
      segments.add(
          new TranscriptSegment(
              i,
              s.text() == null ? "" : s.text().trim(),
              s.start(),
              s.end(),
              segmentConfidence(s),
              null,
              words));
    }
    String language =
        response.language() != null && !response.language().isBlank()
            ? response.language()
            : languageHint;
    double duration = response.duration() == null ? 0.0 : response.duration();
    return new TranscriberOutput(segments, language, duration);
  }

  private static double segmentConfidence(WhisperResponse.Segment segment) {
    if (segment.confidence() != null) {
      return clamp(segment.confidence(), 0.0);
    }
    if (segment.avgLogprob() != null) {
      return clamp(Math.exp(segment.avgLogprob()), 0.0);
    }
    return 0.0;
  }

  private static double clamp(Double value, double fallback) {
    if (value == null || value.isNaN()) {
      return fallback;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
