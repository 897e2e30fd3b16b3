package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ModelsResponse(
    @JsonProperty("whisper_models") List<String> whisperModels,
    @JsonProperty("current_model") String currentModel,
    @JsonProperty("supported_languages") List<String> supportedLanguages,
    @JsonProperty("loaded_capabilities") List<String> loadedCapabilities) {}
