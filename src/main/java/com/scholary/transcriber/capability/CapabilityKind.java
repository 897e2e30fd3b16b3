package com.scholary.transcriber.capability;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CapabilityKind {
  TRANSCRIPTION,
  DIARIZATION,
  TRANSLATION;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
