package com.scholary.transcriber.capability;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.capability.diarization.DiarizationProperties;
import com.scholary.transcriber.capability.translation.TranslationProperties;
import com.scholary.transcriber.capability.whisper.WhisperProperties;
import com.scholary.transcriber.job.ModelSize;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Shared, lazily loaded capability instances keyed by {@link CapabilityKey}.
 *
 * <p>Loads are single-flight: Caffeine's {@code Cache.get(key, loader)} makes concurrent first
 * users of a key wait for one load. A failed load is not cached as a handle; it is remembered as
 * a {@link ModelLoadException} so later jobs and submissions needing the same key fail fast,
 * including callers that were already waiting on the failed load.
 */
@Component
public class CapabilityRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRegistry.class);

  /** Readiness values reported by the health endpoint. */
  public static final String READY = "ready";

  public static final String DISABLED = "disabled";
  public static final String FAILED = "failed";

  private final CapabilityLoader loader;
  private final WhisperProperties whisper;
  private final DiarizationProperties diarization;
  private final TranslationProperties translation;
  private final Cache<CapabilityKey, CapabilityHandle<Transcriber>> transcribers;
  private final Cache<CapabilityKey, CapabilityHandle<Diarizer>> diarizers;
  private final Cache<CapabilityKey, CapabilityHandle<Translator>> translators;
  private final Map<CapabilityKey, ModelLoadException> failures = new ConcurrentHashMap<>();

  public CapabilityRegistry(
      CapabilityLoader loader,
      WhisperProperties whisper,
      DiarizationProperties diarization,
      TranslationProperties translation) {
    this.loader = loader;
    this.whisper = whisper;
    this.diarization = diarization;
    this.translation = translation;
    this.transcribers = Caffeine.newBuilder().build();
    this.diarizers = Caffeine.newBuilder().build();
    this.translators = Caffeine.newBuilder().build();
  }

  public CapabilityKey transcriberKey(ModelSize modelSize) {
    return new CapabilityKey(
        CapabilityKind.TRANSCRIPTION, modelSize.value(), whisper.device(), whisper.computeType());
  }

  public CapabilityKey diarizerKey() {
    return new CapabilityKey(
        CapabilityKind.DIARIZATION, diarization.model(), diarization.device(), null);
  }

  public CapabilityKey translatorKey() {
    return new CapabilityKey(
        CapabilityKind.TRANSLATION, translation.model(), translation.device(), null);
  }

  public ModelSize defaultModelSize() {
    return ModelSize.fromValue(whisper.model());
  }

  public boolean isEnabled(CapabilityKind kind) {
    switch (kind) {
      case TRANSCRIPTION:
        return whisper.enabled();
      case DIARIZATION:
        return diarization.enabled();
      case TRANSLATION:
        return translation.enabled();
      default:
        return false;
    }
  }

  public CapabilityHandle<Transcriber> transcriber(ModelSize modelSize) {
    return handle(
        transcribers, transcriberKey(modelSize), loader::loadTranscriber, whisper.serializeCalls());
  }

  public CapabilityHandle<Diarizer> diarizer() {
    return handle(diarizers, diarizerKey(), loader::loadDiarizer, diarization.serializeCalls());
  }

  public CapabilityHandle<Translator> translator() {
    return handle(
        translators, translatorKey(), loader::loadTranslator, translation.serializeCalls());
  }

  /**
   * Fail fast for a key whose capability is disabled or has already failed to load.
   *
   * @throws ModelLoadException describing the reason
   */
  public void ensureAvailable(CapabilityKey key) {
    if (!isEnabled(key.kind())) {
      throw new ModelLoadException(
          key, "Capability " + key.kind().value() + " is disabled", "Enable it in configuration");
    }
    rethrowFailure(key);
  }

  private void rethrowFailure(CapabilityKey key) {
    ModelLoadException failure = failures.get(key);
    if (failure != null) {
      throw new ModelLoadException(key, failure.getMessage(), failure.getDetails(), failure);
    }
  }

  /** Readiness of one capability kind: {@code ready}, {@code disabled} or {@code failed}. */
  public String status(CapabilityKind kind) {
    if (!isEnabled(kind)) {
      return DISABLED;
    }
    boolean failed = failures.keySet().stream().anyMatch(k -> k.kind() == kind);
    return failed ? FAILED : READY;
  }

  public List<String> loadedKeys() {
    List<String> keys = new ArrayList<>();
    transcribers.asMap().keySet().forEach(key -> keys.add(key.toString()));
    diarizers.asMap().keySet().forEach(key -> keys.add(key.toString()));
    translators.asMap().keySet().forEach(key -> keys.add(key.toString()));
    Collections.sort(keys);
    return keys;
  }

  public List<String> failedKeys() {
    return failures.keySet().stream().map(CapabilityKey::toString).sorted().toList();
  }

  private <T> CapabilityHandle<T> handle(
      Cache<CapabilityKey, CapabilityHandle<T>> cache,
      CapabilityKey key,
      Function<CapabilityKey, T> load,
      boolean serializeCalls) {
    ensureAvailable(key);
    return cache.get(
        key,
        k -> {
          // Callers that waited on a load which just failed must not load again.
          rethrowFailure(k);
          long startMs = System.currentTimeMillis();
          try {
            T capability = load.apply(k);
            LOGGER.info(
                "Capability ready: key={}, serializeCalls={}, loadMs={}",
                k,
                serializeCalls,
                System.currentTimeMillis() - startMs);
            return new CapabilityHandle<>(k, capability, serializeCalls);
          } catch (ModelLoadException e) {
            failures.put(k, e);
            throw e;
          } catch (RuntimeException e) {
            ModelLoadException failure =
                new ModelLoadException(k, "Failed to load " + k, e.getMessage(), e);
            failures.put(k, failure);
            throw failure;
          }
        });
  }
}
