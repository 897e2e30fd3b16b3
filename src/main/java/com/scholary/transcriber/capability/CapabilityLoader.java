package com.scholary.transcriber.capability;

/**
 * Performs the expensive part of making a capability usable. Called at most once per key at a
 * time; the registry caches what it returns.
 */
public interface CapabilityLoader {

  /** @throws ModelLoadException if the model cannot be loaded */
  Transcriber loadTranscriber(CapabilityKey key);

  /** @throws ModelLoadException if the pipeline cannot be loaded */
  Diarizer loadDiarizer(CapabilityKey key);

  /** @throws ModelLoadException if the model cannot be loaded */
  Translator loadTranslator(CapabilityKey key);
}
