package com.scholary.transcriber.capability;

import java.io.IOException;

/** A model server answered with a non-2xx status. */
public class ModelServerResponseException extends IOException {

  private final int statusCode;

  public ModelServerResponseException(String server, int statusCode, String body) {
    super(String.format("%s returned status %d: %s", server, statusCode, abbreviate(body)));
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isTransient() {
    return CapabilityException.isTransientStatus(statusCode);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 300 ? body : body.substring(0, 300) + "...";
  }
}
