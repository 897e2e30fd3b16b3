package com.scholary.transcriber.export;

import com.scholary.transcriber.error.ValidationException;
import java.util.Arrays;
import java.util.Locale;

public enum ExportFormat {
  TXT("text/plain; charset=UTF-8", ".txt"),
  JSON("application/json", ".json"),
  SRT("application/x-subrip; charset=UTF-8", ".srt");

  private final String contentType;
  private final String extension;

  ExportFormat(String contentType, String extension) {
    this.contentType = contentType;
    this.extension = extension;
  }

  public String contentType() {
    return contentType;
  }

  public String extension() {
    return extension;
  }

  public static ExportFormat fromValue(String value) {
    return Arrays.stream(values())
        .filter(f -> f.name().equalsIgnoreCase(value == null ? "" : value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new ValidationException(
                    "Unsupported export format: " + value,
                    "Supported formats: txt, json, srt"));
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
