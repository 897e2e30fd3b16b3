package com.scholary.transcriber.capability.diarization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scholary.transcriber.capability.CapabilityKey;
import com.scholary.transcriber.capability.DiarizationException;
import com.scholary.transcriber.capability.Diarizer;
import com.scholary.transcriber.capability.ModelServerClient;
import com.scholary.transcriber.capability.ModelServerResponseException;
import com.scholary.transcriber.capability.MultipartBody;
import com.scholary.transcriber.transcript.SpeakerTurn;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HTTP client for the speaker diarization API, bound to one loaded pipeline. */
public class DiarizationClient implements Diarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationClient.class);

  private final ModelServerClient server;
  private final CapabilityKey key;

  public DiarizationClient(ModelServerClient server, CapabilityKey key) {
    this.server = server;
    this.key = key;
  }

  @Override
  public List<SpeakerTurn> diarize(Path audio, Integer numSpeakersHint) {
    LOGGER.info(
        "Starting diarization: file={}, pipeline={}, numSpeakers={}",
        audio.getFileName(),
        key.model(),
        numSpeakersHint);

    DiarizationResponse response;
    try {
      MultipartBody body =
          new MultipartBody()
              .file("file", audio, "audio/wav")
              .field("model", key.model())
              .field("num_speakers", numSpeakersHint);
      response = server.postMultipart("/api/v1/diarize", body, DiarizationResponse.class);
    } catch (JsonProcessingException e) {
      throw new DiarizationException(
          "Failed to perform speaker diarization", e.getOriginalMessage(), false, e);
    } catch (ModelServerResponseException e) {
      throw new DiarizationException(
          "Failed to perform speaker diarization", e.getMessage(), e.isTransient(), e);
    } catch (IOException e) {
      throw new DiarizationException(
          "Failed to perform speaker diarization", e.getMessage(), true, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DiarizationException("Diarization interrupted", e.getMessage(), false, e);
    }

    List<SpeakerTurn> turns = toTurns(response);
    LOGGER.info("Diarization completed: {} speaker turns found", turns.size());
    return turns;
  }

  /** Drop empty or unlabeled turns and order the rest by start. */
  static List<SpeakerTurn> toTurns(DiarizationResponse response) {
    if (response == null || response.turns() == null) {
      return List.of();
    }
    return response.turns().stream()
        .filter(t -> t.speaker() != null && !t.speaker().isBlank() && t.end() > t.start())
        .map(t -> new SpeakerTurn(t.start(), t.end(), t.speaker()))
        .sorted(
            Comparator.comparingDouble(SpeakerTurn::start)
                .thenComparingDouble(SpeakerTurn::end))
        .toList();
  }
}
