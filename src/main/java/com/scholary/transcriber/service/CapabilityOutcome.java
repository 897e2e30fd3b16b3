package com.scholary.transcriber.service;

import com.scholary.transcriber.error.TranscriberException;
import java.util.Objects;

/**
 * Result of one capability invocation, retries included.
 *
 * <ul>
 *   <li>{@code OK}: {@code value} holds the answer.
 *   <li>{@code DEGRADED}: the capability failed but the job can go on without it.
 *   <li>{@code FATAL}: the capability failed and the job must fail with {@code error}.
 * </ul>
 */
public record CapabilityOutcome<T>(Kind kind, T value, TranscriberException error, int attempts) {

  public enum Kind {
    OK,
    DEGRADED,
    FATAL
  }

  public static <T> CapabilityOutcome<T> ok(T value, int attempts) {
    return new CapabilityOutcome<>(Kind.OK, value, null, attempts);
  }

  public static <T> CapabilityOutcome<T> degraded(TranscriberException error, int attempts) {
    return new CapabilityOutcome<>(Kind.DEGRADED, null, Objects.requireNonNull(error), attempts);
  }

  public static <T> CapabilityOutcome<T> fatal(TranscriberException error, int attempts) {
    return new CapabilityOutcome<>(Kind.FATAL, null, Objects.requireNonNull(error), attempts);
  }

  public boolean isOk() {
    return kind == Kind.OK;
  }

  /** The value, or the error thrown when the outcome is fatal. */
  public T valueOrThrow() {
    if (kind == Kind.FATAL) {
      throw error;
    }
    return value;
  }
}
