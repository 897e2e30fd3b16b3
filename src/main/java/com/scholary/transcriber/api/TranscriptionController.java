package com.scholary.transcriber.api;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.export.ExportFormat;
import com.scholary.transcriber.export.TranscriptExporter;
import com.scholary.transcriber.job.InvalidStateException;
import com.scholary.transcriber.job.JobOptions;
import com.scholary.transcriber.job.JobStatus;
import com.scholary.transcriber.job.JobStore;
import com.scholary.transcriber.job.ModelSize;
import com.scholary.transcriber.job.TranscriptionJob;
import com.scholary.transcriber.scheduler.JobScheduler;
import com.scholary.transcriber.service.JobSubmissionService;
import com.scholary.transcriber.service.ProgressReporter;
import com.scholary.transcriber.service.TranslationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for transcription jobs.
 *
 * <p>Uploads are admitted synchronously and processed in the background. Clients poll the job,
 * or follow it as server-sent events, then export or translate the result.
 */
@RestController
@RequestMapping("/api/v1/transcribe")
@Tag(name = "Transcription", description = "Audio transcription jobs")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final JobSubmissionService submissionService;
  private final ProgressReporter progressReporter;
  private final JobScheduler scheduler;
  private final JobStore jobStore;
  private final TranscriptExporter exporter;
  private final TranslationService translationService;

  public TranscriptionController(
      JobSubmissionService submissionService,
      ProgressReporter progressReporter,
      JobScheduler scheduler,
      JobStore jobStore,
      TranscriptExporter exporter,
      TranslationService translationService) {
    this.submissionService = submissionService;
    this.progressReporter = progressReporter;
    this.scheduler = scheduler;
    this.jobStore = jobStore;
    this.exporter = exporter;
    this.translationService = translationService;
  }

  @PostMapping(path = "/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload an audio file for transcription",
      description =
          "Validates the upload, creates a job and queues it. Returns the job id right away.")
  public ResponseEntity<JobCreateResponse> transcribeFile(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "language", required = false) String language,
      @RequestParam(value = "model_size", defaultValue = "base") String modelSize,
      @RequestParam(value = "enable_diarization", defaultValue = "false")
          boolean enableDiarization,
      @RequestParam(value = "num_speakers", required = false) Integer numSpeakers) {

    LOGGER.info(
        "Upload received: file={}, size={}, model={}, diarization={}",
        file.getOriginalFilename(),
        file.getSize(),
        modelSize,
        enableDiarization);
    JobOptions options =
        new JobOptions(language, ModelSize.fromValue(modelSize), enableDiarization, numSpeakers);

    TranscriptionJob job;
    try (InputStream content = file.getInputStream()) {
      job = submissionService.submit(file.getOriginalFilename(), file.getSize(), content, options);
    } catch (IOException e) {
      throw new TranscriberException(
          ErrorKind.INTERNAL_ERROR, "Failed to read uploaded file", e.getMessage(), e);
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new JobCreateResponse(job.id(), job.status(), JobCreateResponse.QUEUED_MESSAGE));
  }

  @GetMapping("/job/{jobId}")
  @Operation(summary = "Get job status", description = "Current snapshot of a job")
  public TranscriptionJob getJob(@PathVariable String jobId) {
    return progressReporter.status(jobId);
  }

  @GetMapping(path = "/job/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Follow a job",
      description = "Server-sent events with a job snapshot per change, ending after completion")
  public SseEmitter streamJob(@PathVariable String jobId) {
    return progressReporter.stream(jobId);
  }

  @PostMapping("/job/{jobId}/cancel")
  @Operation(summary = "Cancel a job", description = "The worker stops at its next checkpoint")
  public TranscriptionJob cancelJob(@PathVariable String jobId) {
    LOGGER.info("Cancel requested for job {}", jobId);
    return scheduler.cancel(jobId);
  }

  @DeleteMapping("/job/{jobId}")
  @Operation(summary = "Delete a finished job", description = "Removes the job and its files")
  public ResponseEntity<Void> deleteJob(@PathVariable String jobId) {
    jobStore.delete(jobId);
    LOGGER.info("Deleted job {}", jobId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/job/{jobId}/export/{format}")
  @Operation(
      summary = "Export a transcript",
      description = "txt, json or srt. Repeat speaker=ID=Name to rename speakers.")
  public ResponseEntity<byte[]> exportJob(
      @PathVariable String jobId,
      @PathVariable String format,
      @RequestParam(value = "speaker", required = false) List<String> speakers) {
    ExportFormat exportFormat = ExportFormat.fromValue(format);
    Map<String, String> speakerNames = parseSpeakerNames(speakers);

    TranscriptionJob job = progressReporter.status(jobId);
    if (job.status() != JobStatus.COMPLETED) {
      throw new InvalidStateException(
          "Job "
              + jobId
              + " is "
              + job.status().value()
              + ", only completed jobs can be exported");
    }

    byte[] body = exporter.export(job.result(), exportFormat, speakerNames);
    String filename = "transcript_" + jobId + exportFormat.extension();
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, exportFormat.contentType())
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(body);
  }

  @PostMapping("/job/{jobId}/translate")
  @Operation(
      summary = "Translate a transcript",
      description = "Translates the text of a completed job into target_language")
  public TranslationResponse translateJob(
      @PathVariable String jobId, @Valid @RequestBody TranslationRequest request) {
    return TranslationResponse.from(
        translationService.translate(jobId, request.targetLanguage()));
  }

  /** Parses {@code ID=Name} pairs. The first {@code =} separates id from name. */
  static Map<String, String> parseSpeakerNames(List<String> speakers) {
    Map<String, String> names = new LinkedHashMap<>();
    if (speakers == null) {
      return names;
    }
    for (String speaker : speakers) {
      int separator = speaker.indexOf('=');
      if (separator <= 0 || separator == speaker.length() - 1) {
        throw new ValidationException(
            "Invalid parameters: speaker must look like ID=Name", "speaker=" + speaker);
      }
      names.put(
          speaker.substring(0, separator).trim(), speaker.substring(separator + 1).trim());
    }
    return names;
  }
}
