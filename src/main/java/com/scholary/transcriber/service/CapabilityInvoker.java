package com.scholary.transcriber.service;

import com.scholary.transcriber.capability.CapabilityException;
import com.scholary.transcriber.capability.CapabilityHandle;
import com.scholary.transcriber.capability.ModelLoadException;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.logging.StructuredLogger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Calls a capability with the service's retry policy and reports a {@link CapabilityOutcome}.
 *
 * <p>A transient {@link CapabilityException} gets exactly one more attempt; permanent failures
 * and {@link ModelLoadException} get none. A failure that is still there afterwards is {@code
 * DEGRADED} for optional capabilities and {@code FATAL} otherwise; a load failure is always
 * fatal. The token is checked before every attempt and after the last one.
 */
@Component
public class CapabilityInvoker {

  private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityInvoker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int MAX_ATTEMPTS = 2;

  private final long retryBackoffMs;

  public CapabilityInvoker(@Value("${capabilities.retry-backoff-ms:500}") long retryBackoffMs) {
    this.retryBackoffMs = retryBackoffMs;
  }

  /**
   * @param name capability name for logs
   * @param handle acquires the loaded capability; may throw {@link ModelLoadException}
   * @param call the work to do with it
   * @param optional whether the job can complete without this capability
   */
  public <C, R> CapabilityOutcome<R> invoke(
      String name,
      Supplier<CapabilityHandle<C>> handle,
      Function<C, R> call,
      boolean optional,
      CancellationToken token) {

    CapabilityHandle<C> capability;
    try {
      token.throwIfCancelled();
      capability = handle.get();
    } catch (ModelLoadException e) {
      STRUCTURED_LOGGER.logCapabilityFailed(name, 0, "ModelLoadException", e.getMessage(), false);
      return CapabilityOutcome.fatal(e, 0);
    }

    int attempt = 0;
    while (true) {
      attempt++;
      token.throwIfCancelled();
      try {
        R value = capability.call(call);
        token.throwIfCancelled();
        return CapabilityOutcome.ok(value, attempt);

      } catch (ModelLoadException e) {
        STRUCTURED_LOGGER.logCapabilityFailed(
            name, attempt, "ModelLoadException", e.getMessage(), false);
        return CapabilityOutcome.fatal(e, attempt);

      } catch (CapabilityException e) {
        if (e.isTransient() && attempt < MAX_ATTEMPTS) {
          STRUCTURED_LOGGER.logCapabilityRetry(
              name, attempt, e.getClass().getSimpleName(), e.getMessage());
          pause();
          continue;
        }
        STRUCTURED_LOGGER.logCapabilityFailed(
            name, attempt, e.getClass().getSimpleName(), detailOf(e), optional);
        return optional
            ? CapabilityOutcome.degraded(e, attempt)
            : CapabilityOutcome.fatal(e, attempt);
      }
    }
  }

  private void pause() {
    if (retryBackoffMs <= 0) {
      return;
    }
    try {
      Thread.sleep(retryBackoffMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Retry backoff interrupted");
    }
  }

  private static String detailOf(CapabilityException e) {
    return e.getDetails() == null ? e.getMessage() : e.getMessage() + ": " + e.getDetails();
  }
}
