package com.scholary.transcriber.error;

import java.util.List;

/**
 * Rejected request input: unsupported format, oversized or empty upload, bad options.
 *
 * <p>Always raised before a job exists, so it never shows up as a job failure. The optional
 * filename, expected formats and suggestions end up in the error body.
 */
public class ValidationException extends TranscriberException {

  private final String filename;
  private final List<String> expectedFormats;
  private final List<String> suggestions;

  public ValidationException(String message, String details) {
    this(message, details, null, List.of(), List.of());
  }

  public ValidationException(
      String message,
      String details,
      String filename,
      List<String> expectedFormats,
      List<String> suggestions) {
    super(ErrorKind.VALIDATION_ERROR, message, details);
    this.filename = filename;
    this.expectedFormats = expectedFormats == null ? List.of() : List.copyOf(expectedFormats);
    this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }

  public String getFilename() {
    return filename;
  }

  public List<String> getExpectedFormats() {
    return expectedFormats;
  }

  public List<String> getSuggestions() {
    return suggestions;
  }
}
