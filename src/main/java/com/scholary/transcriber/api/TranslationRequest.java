package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record TranslationRequest(
    @JsonProperty("target_language") @NotBlank String targetLanguage) {}
