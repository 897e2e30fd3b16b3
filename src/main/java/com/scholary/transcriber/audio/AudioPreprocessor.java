package com.scholary.transcriber.audio;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.job.CancellationToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an upload into an {@link AudioAsset} the capabilities can consume.
 *
 * <p>Two phases. {@link #validate} and {@link #stage} run on the request thread, before a job
 * exists, so a bad upload is rejected with a {@link ValidationException} and never becomes a job.
 * {@link #prepare} runs on the worker: probe, normalize to mono 16 kHz PCM WAV, then cut into
 * chunks when the file is long. Any decode failure there is an {@link AudioProcessingException}
 * and fails the job.
 */
@Component
public class AudioPreprocessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioPreprocessor.class);

  private static final int MAX_STEM_LENGTH = 50;

  private final AudioProperties properties;
  private final AudioToolkit toolkit;
  private final ChunkPlanner chunkPlanner;

  public AudioPreprocessor(
      AudioProperties properties, AudioToolkit toolkit, ChunkPlanner chunkPlanner) {
    this.properties = properties;
    this.toolkit = toolkit;
    this.chunkPlanner = chunkPlanner;
  }

  public List<String> supportedFormats() {
    return properties.supportedFormats();
  }

  /**
   * Check the declared name and size of an upload.
   *
   * @throws ValidationException if the file is empty, too large or of an unsupported type
   */
  public void validate(String declaredName, long sizeBytes) {
    if (sizeBytes <= 0) {
      throw new ValidationException(
          "Empty file received",
          "The uploaded file contains no data. This may be a browser or network issue.",
          declaredName,
          List.of(),
          List.of(
              "Try uploading the file again",
              "Check if the file is accessible on your system"));
    }

    if (sizeBytes > properties.maxUploadBytes()) {
      double sizeMb = sizeBytes / (1024.0 * 1024.0);
      throw new ValidationException(
          "File too large",
          String.format(
              Locale.ROOT,
              "File size is %.1fMB, maximum allowed is %dMB",
              sizeMb,
              properties.maxUploadMb()),
          declaredName,
          List.of(),
          List.of(
              "Compress the audio file before uploading",
              "Split the audio into smaller segments"));
    }

    String extension = extensionOf(declaredName);
    if (!isSupported(extension)) {
      throw new ValidationException(
          "Unsupported file format: " + (extension.isEmpty() ? "(none)" : extension),
          "The file extension " + extension + " is not supported",
          declaredName,
          properties.supportedFormats(),
          List.of(
              "Convert to a supported format: " + String.join(", ", properties.supportedFormats()),
              "Use ffmpeg to convert: ffmpeg -i input_file output.wav"));
    }
  }

  /**
   * Write an upload to {@code {workDir}/uploads} under a unique name.
   *
   * <p>The written byte count is checked again, since a multipart part may not report its size.
   */
  public StagedUpload stage(InputStream content, String declaredName) {
    Path uploads = Paths.get(properties.workDir(), "uploads");
    Path target = uploads.resolve(uniqueFilename(declaredName));
    long written;
    try {
      Files.createDirectories(uploads);
      written = Files.copy(content, target);
    } catch (IOException e) {
      deleteRecursively(target);
      LOGGER.error("Failed to save upload {}: {}", declaredName, e.getMessage());
      throw new TranscriberException(
          ErrorKind.INTERNAL_ERROR, "Failed to save uploaded file", e.getMessage(), e);
    }

    try {
      validate(declaredName, written);
    } catch (ValidationException e) {
      deleteRecursively(target);
      throw e;
    }

    LOGGER.info("Saved upload {} to {} ({} bytes)", declaredName, target, written);
    return new StagedUpload(target, declaredName, written);
  }

  /**
   * Decode, normalize and chunk a staged upload.
   *
   * @throws AudioProcessingException if the file cannot be decoded or has no duration
   * @throws com.scholary.transcriber.job.JobCanceledException if the token is cancelled between
   *     ffmpeg runs
   */
  public AudioAsset prepare(StagedUpload upload, CancellationToken token) {
    Path source = upload.path();
    long size;
    try {
      size = Files.size(source);
    } catch (IOException e) {
      throw new AudioProcessingException("Uploaded file is missing", e.getMessage(), e);
    }
    validate(upload.originalName(), size);
    token.throwIfCancelled();

    AudioInfo sourceInfo = probe(source, "Cannot read audio file");
    if (sourceInfo.durationSeconds() <= 0) {
      throw new AudioProcessingException(
          "Audio file has zero duration", "ffprobe reported no decodable audio");
    }

    Path workDir = Paths.get(properties.workDir(), "processed", stemOf(source.getFileName()));
    try {
      Files.createDirectories(workDir);
      Path normalized = workDir.resolve("normalized.wav");
      toolkit.normalize(source, normalized, properties.targetSampleRate());
      token.throwIfCancelled();

      AudioInfo info = probe(normalized, "Failed to convert audio to WAV format");
      double duration =
          info.durationSeconds() > 0 ? info.durationSeconds() : sourceInfo.durationSeconds();

      List<TimeRange> ranges = chunkPlanner.plan(duration);
      List<AudioChunk> chunks = new ArrayList<>(ranges.size());
      if (ranges.size() == 1) {
        chunks.add(new AudioChunk(0, normalized, 0.0, duration));
      } else {
        for (int i = 0; i < ranges.size(); i++) {
          TimeRange range = ranges.get(i);
          Path chunkPath = workDir.resolve(String.format(Locale.ROOT, "chunk_%03d.wav", i));
          toolkit.cut(normalized, range, chunkPath);
          chunks.add(new AudioChunk(i, chunkPath, range.start(), range.duration()));
          token.throwIfCancelled();
        }
      }

      LOGGER.info(
          "Prepared {}: duration={}s, sourceFormat={}, chunks={}",
          upload.originalName(),
          duration,
          sourceInfo.formatName(),
          chunks.size());
      return new AudioAsset(
          normalized,
          workDir,
          duration,
          properties.targetSampleRate(),
          1,
          sourceInfo.formatName(),
          chunks);

    } catch (IOException e) {
      deleteRecursively(workDir);
      throw new AudioProcessingException("Failed to process audio file", e.getMessage(), e);
    } catch (RuntimeException e) {
      deleteRecursively(workDir);
      throw e;
    }
  }

  /** Drop the normalized file and chunks once a job is done, unless configured to keep them. */
  public void release(AudioAsset asset) {
    if (asset == null || properties.retainNormalized()) {
      return;
    }
    asset.release();
    LOGGER.debug("Released normalized audio in {}", asset.workDir());
  }

  /** Delete a staged upload that never became a job. */
  public void discard(StagedUpload upload) {
    if (upload != null) {
      deleteRecursively(upload.path());
    }
  }

  private AudioInfo probe(Path file, String message) {
    try {
      return toolkit.probe(file);
    } catch (IOException e) {
      throw new AudioProcessingException(message, e.getMessage(), e);
    }
  }

  private boolean isSupported(String extension) {
    return properties.supportedFormats().stream().anyMatch(f -> f.equalsIgnoreCase(extension));
  }

  /** Unique name for a staged upload: 12 hex chars, the sanitized stem, the extension. */
  static String uniqueFilename(String declaredName) {
    String name = declaredName == null || declaredName.isBlank() ? "audio.wav" : declaredName;
    name = Paths.get(name.replace('\\', '/')).getFileName().toString();
    String extension = extensionOf(name);
    String stem = name.substring(0, name.length() - extension.length());
    stem = stem.replaceAll("[^A-Za-z0-9._-]", "_");
    if (stem.length() > MAX_STEM_LENGTH) {
      stem = stem.substring(0, MAX_STEM_LENGTH);
    }
    String id = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    return id + "_" + stem + extension;
  }

  static String extensionOf(String name) {
    if (name == null) {
      return "";
    }
    int dot = name.lastIndexOf('.');
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (dot <= slash + 1 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static String stemOf(Path fileName) {
    String name = fileName.toString();
    return name.substring(0, name.length() - extensionOf(name).length());
  }

  private static void deleteRecursively(Path path) {
    if (!Files.exists(path)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(path)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (IOException e) {
                  LOGGER.warn("Failed to delete {}: {}", p, e.getMessage());
                }
              });
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up {}: {}", path, e.getMessage());
    }
  }
}
