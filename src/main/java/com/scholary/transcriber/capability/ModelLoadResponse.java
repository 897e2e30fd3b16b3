package com.scholary.transcriber.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Answer of {@code POST /api/v1/models/load}, shared by all model servers. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelLoadResponse(String status, String model, String message) {

  public boolean isLoaded() {
    return status == null || "loaded".equalsIgnoreCase(status) || "ok".equalsIgnoreCase(status);
  }
}
