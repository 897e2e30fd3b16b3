package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.service.TranslationService.Translation;

public record TranslationResponse(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("source_language") String sourceLanguage,
    @JsonProperty("target_language") String targetLanguage,
    @JsonProperty("translated_text") String translatedText) {

  static TranslationResponse from(Translation translation) {
    return new TranslationResponse(
        translation.jobId(),
        translation.sourceLanguage(),
        translation.targetLanguage(),
        translation.translatedText());
  }
}
