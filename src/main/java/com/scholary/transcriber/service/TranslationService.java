package com.scholary.transcriber.service;

import com.scholary.transcriber.capability.CapabilityRegistry;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.job.CancellationToken;
import com.scholary.transcriber.job.InvalidStateException;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.transcript.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Translates the text of a completed job on request. Nothing is stored. */
@Service
public class TranslationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

  private final FeatureProperties features;
  private final JobStore jobStore;
  private final CapabilityRegistry registry;
  private final CapabilityInvoker invoker;

  public TranslationService(
      FeatureProperties features,
      JobStore jobStore,
      CapabilityRegistry registry,
      CapabilityInvoker invoker) {
    this.features = features;
    this.jobStore = jobStore;
    this.registry = registry;
    this.invoker = invoker;
  }

  public boolean isEnabled() {
    return features.translationEnabled();
  }

  /**
   * @throws ValidationException if translation is switched off or the target is blank
   * @throws InvalidStateException if the job has not completed
   * @throws com.scholary.transcriber.capability.TranslationException if the translator fails
   *     twice in a row
   */
  public Translation translate(String jobId, String targetLanguage) {
    if (!isEnabled()) {
      throw new ValidationException(
          "Translation is not enabled", "Set features.translation-enabled=true to use it");
    }
    if (targetLanguage == null || targetLanguage.isBlank()) {
      throw new ValidationException(
          "Invalid parameters: target_language is required", "target_language=" + targetLanguage);
    }
    TranscriptionJob job = jobStore.get(jobId);
    if (job.status() != JobStatus.COMPLETED) {
      throw new InvalidStateException(
          "Job "
              + jobId
              + " is "
              + job.status().value()
              + ", only completed jobs can be translated");
    }

    TranscriptionResult result = job.result();
    String source =
        TranscriptionCoordinator.UNKNOWN_LANGUAGE.equals(result.language())
            ? null
            : result.language();
    String target = targetLanguage.trim();
    LOGGER.info("Translating job {} from {} to {}", jobId, source, target);

    String translated =
        invoker
            .invoke(
                "translation",
                registry::translator,
                translator -> translator.translate(result.text(), source, target),
                false,
                CancellationToken.none())
            .valueOrThrow();
    return new Translation(jobId, source, target, translated);
  }

  /** A translated transcript. */
  public record Translation(
      String jobId, String sourceLanguage, String targetLanguage, String translatedText) {}
}
