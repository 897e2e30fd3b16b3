package com.scholary.transcriber.api;

import com.scholary.transcriber.capability.CapabilityKind;
import com.scholary.transcriber.capability.CapabilityRegistry;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.ModelSize;
import com.scholary.transcriber.scheduler.JobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Model catalogue and health. */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "System", description = "Models and service health")
public class SystemController {

  static final String HEALTHY = "healthy";
  static final String DEGRADED = "degraded";

  /** The most common of the languages Whisper recognizes. */
  static final List<String> SUPPORTED_LANGUAGES =
      List.of(
          "en", "es", "fr", "de", "it", "pt", "nl", "ru", "zh", "ja", "ko", "ar", "hi", "tr",
          "pl", "uk", "ro", "sv", "cs", "da", "fi", "no", "sk", "bg", "hr", "sl", "et", "lv",
          "lt", "el", "he", "id", "ms", "th", "vi", "fa", "af", "sq", "am", "hy");

  private final CapabilityRegistry registry;
  private final JobScheduler scheduler;
  private final JobStore jobStore;
  private final String version;

  public SystemController(
      CapabilityRegistry registry,
      JobScheduler scheduler,
      JobStore jobStore,
      @Value("${transcriber.version:0.1.0}") String version) {
    this.registry = registry;
    this.scheduler = scheduler;
    this.jobStore = jobStore;
    this.version = version;
  }

  @GetMapping("/models")
  @Operation(summary = "List models", description = "Model sizes, default model and languages")
  public ModelsResponse models() {
    return new ModelsResponse(
        ModelSize.values(true),
        registry.defaultModelSize().value(),
        SUPPORTED_LANGUAGES,
        registry.loadedKeys());
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Capability readiness and queue depth")
  public HealthResponse health() {
    Map<String, String> services = new LinkedHashMap<>();
    for (CapabilityKind kind : CapabilityKind.values()) {
      services.put(kind.value(), registry.status(kind));
    }
    String status =
        CapabilityRegistry.READY.equals(services.get(CapabilityKind.TRANSCRIPTION.value()))
            ? HEALTHY
            : DEGRADED;

    Map<String, Long> jobs = new LinkedHashMap<>();
    Map<JobStatus, Long> counts = jobStore.countByStatus();
    for (JobStatus jobStatus : JobStatus.values()) {
      jobs.put(jobStatus.value(), counts.getOrDefault(jobStatus, 0L));
    }
    HealthResponse.Queue queue =
        new HealthResponse.Queue(
            scheduler.activeCount(), scheduler.queuedCount(), scheduler.maxConcurrentJobs(), jobs);
    return new HealthResponse(status, services, version, queue);
  }
}
