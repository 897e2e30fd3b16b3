package com.scholary.transcriber.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.error.ValidationException;

/**
 * Options a client submits with a file.
 *
 * @param language language hint, null to let the recognizer detect it
 * @param modelSize recognizer model to run
 * @param enableDiarization label segments with speakers
 * @param numSpeakers speaker count hint for diarization, null to auto-detect
 */
public record JobOptions(
    String language,
    @JsonProperty("model_size") ModelSize modelSize,
    @JsonProperty("enable_diarization") boolean enableDiarization,
    @JsonProperty("num_speakers") Integer numSpeakers) {

  public JobOptions {
    language = language == null || language.isBlank() ? null : language.trim();
    modelSize = modelSize == null ? ModelSize.BASE : modelSize;
    if (numSpeakers != null && numSpeakers < 1) {
      throw new ValidationException(
          "Invalid parameters: num_speakers must be at least 1", "num_speakers=" + numSpeakers);
    }
  }

  public static JobOptions defaults() {
    return new JobOptions(null, ModelSize.BASE, false, null);
  }
}
