package com.scholary.transcriber.capability;

import java.util.Objects;

/**
 * Identity of one loaded model instance. Two jobs that need the same key share the instance.
 *
 * @param kind what the model does
 * @param model model name, e.g. {@code base} for Whisper
 * @param device where the server runs it, e.g. {@code cpu}
 * @param computeType numeric precision, e.g. {@code int8}; may be empty
 */
public record CapabilityKey(CapabilityKind kind, String model, String device, String computeType) {

  public CapabilityKey {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(model, "model");
    device = device == null ? "" : device;
    computeType = computeType == null ? "" : computeType;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.value()).append(':').append(model);
    if (!device.isEmpty()) {
      sb.append('/').append(device);
    }
    if (!computeType.isEmpty()) {
      sb.append('/').append(computeType);
    }
    return sb.toString();
  }
}
