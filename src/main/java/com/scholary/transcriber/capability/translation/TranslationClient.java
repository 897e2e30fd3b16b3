package com.scholary.transcriber.capability.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.scholary.transcriber.capability.CapabilityKey;
import com.scholary.transcriber.capability.ModelServerClient;
import com.scholary.transcriber.capability.ModelServerResponseException;
import com.scholary.transcriber.capability.TranslationException;
import com.scholary.transcriber.capability.Translator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HTTP client for the text translation API. */
public class TranslationClient implements Translator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationClient.class);

  private final ModelServerClient server;
  private final CapabilityKey key;

  public TranslationClient(ModelServerClient server, CapabilityKey key) {
    this.server = server;
    this.key = key;
  }

  @Override
  public String translate(String text, String sourceLanguage, String targetLanguage) {
    LOGGER.info(
        "Translating {} chars: {} -> {}, model={}",
        text.length(),
        sourceLanguage,
        targetLanguage,
        key.model());

    Response response;
    try {
      response =
          server.postJson(
              "/api/v1/translate",
              new Request(text, sourceLanguage, targetLanguage, key.model()),
              Response.class);
    } catch (JsonProcessingException e) {
      throw new TranslationException("Failed to translate text", e.getOriginalMessage(), false, e);
    } catch (ModelServerResponseException e) {
      throw new TranslationException(
          "Failed to translate text", e.getMessage(), e.isTransient(), e);
    } catch (IOException e) {
      throw new TranslationException("Failed to translate text", e.getMessage(), true, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException("Translation interrupted", e.getMessage(), false, e);
    }

    if (response == null || response.translatedText() == null) {
      throw new TranslationException(
          "Failed to translate text", "Empty translation response", false);
    }
    return response.translatedText();
  }

  record Request(
      String text,
      @JsonProperty("source_language") String sourceLanguage,
      @JsonProperty("target_language") String targetLanguage,
      String model) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Response(@JsonProperty("translated_text") String translatedText) {}
}
