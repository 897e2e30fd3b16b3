package com.scholary.transcriber.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.capability.diarization.DiarizationClient;
import com.scholary.transcriber.capability.diarization.DiarizationProperties;
import com.scholary.transcriber.capability.translation.TranslationClient;
import com.scholary.transcriber.capability.translation.TranslationProperties;
import com.scholary.transcriber.capability.whisper.WhisperClient;
import com.scholary.transcriber.capability.whisper.WhisperProperties;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads capabilities hosted on remote model servers.
 *
 * <p>Loading asks the server to bring the model into memory ({@code POST
 * /api/v1/models/load}) and then hands out a client bound to that model. Any failure, including
 * an unreachable server, is a {@link ModelLoadException}.
 */
@Component
public class HttpCapabilityLoader implements CapabilityLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpCapabilityLoader.class);

  private final ModelServerClient whisperServer;
  private final ModelServerClient diarizationServer;
  private final ModelServerClient translationServer;
  private final WhisperProperties whisperProperties;
  private final DiarizationProperties diarizationProperties;

  public HttpCapabilityLoader(
      WhisperProperties whisperProperties,
      DiarizationProperties diarizationProperties,
      TranslationProperties translationProperties,
      ObjectMapper objectMapper) {
    this.whisperProperties = whisperProperties;
    this.diarizationProperties = diarizationProperties;
    this.whisperServer = new ModelServerClient("whisper", whisperProperties, objectMapper);
    this.diarizationServer =
        new ModelServerClient("diarization", diarizationProperties, objectMapper);
    this.translationServer =
        new ModelServerClient("translation", translationProperties, objectMapper);
  }

  @Override
  public Transcriber loadTranscriber(CapabilityKey key) {
    load(whisperServer, key, null, "Failed to load Whisper model " + key.model());
    return new WhisperClient(whisperServer, key, whisperProperties);
  }

  @Override
  public Diarizer loadDiarizer(CapabilityKey key) {
    String token = diarizationProperties.authToken();
    if (token == null || token.isBlank()) {
      throw new ModelLoadException(
          key,
          "Pyannote authentication token not configured",
          "Set capabilities.diarization.auth-token to a Hugging Face token with access to "
              + key.model());
    }
    load(diarizationServer, key, token, "Failed to load diarization pipeline");
    return new DiarizationClient(diarizationServer, key);
  }

  @Override
  public Translator loadTranslator(CapabilityKey key) {
    load(translationServer, key, null, "Failed to load translation model " + key.model());
    return new TranslationClient(translationServer, key);
  }

  private void load(ModelServerClient server, CapabilityKey key, String authToken, String message) {
    LOGGER.info("Loading {} on {}", key, server.baseUrl());
    ModelLoadResponse response;
    try {
      response =
          server.postJson(
              "/api/v1/models/load",
              new LoadRequest(key.model(), key.device(), key.computeType(), authToken),
              ModelLoadResponse.class);
    } catch (IOException e) {
      LOGGER.error("Failed to load {}: {}", key, e.getMessage());
      throw new ModelLoadException(key, message, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelLoadException(key, message, "Interrupted while loading", e);
    }

    if (response != null && !response.isLoaded()) {
      throw new ModelLoadException(key, message, response.message());
    }
    LOGGER.info("Loaded {}", key);
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  record LoadRequest(
      String model,
      String device,
      @JsonProperty("compute_type") String computeType,
      @JsonProperty("auth_token") String authToken) {}
}
