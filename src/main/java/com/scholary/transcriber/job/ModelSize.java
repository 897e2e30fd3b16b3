package com.scholary.transcriber.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.scholary.transcriber.error.ValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Whisper model sizes a job may ask for. */
public enum ModelSize {
  TINY,
  BASE,
  SMALL,
  MEDIUM,
  LARGE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static List<String> values(boolean lowerCase) {
    return Arrays.stream(values()).map(m -> lowerCase ? m.value() : m.name()).toList();
  }

  @JsonCreator
  public static ModelSize fromValue(String value) {
    if (value == null || value.isBlank()) {
      return BASE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Invalid parameters: unknown model size " + value,
          "Supported model sizes: " + String.join(", ", values(true)));
    }
  }
}
