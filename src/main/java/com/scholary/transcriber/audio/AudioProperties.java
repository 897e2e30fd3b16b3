package com.scholary.transcriber.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for upload validation and audio preparation, bound to {@code audio.*}.
 *
 * <p>Files longer than {@code chunkThresholdSeconds} are cut into consecutive, non-overlapping
 * chunks of {@code chunkSeconds}.
 */
@ConfigurationProperties(prefix = "audio")
@Validated
public record AudioProperties(
    @NotBlank String workDir,
    @Positive long maxUploadMb,
    @NotEmpty List<String> supportedFormats,
    @Positive int targetSampleRate,
    @Positive double chunkThresholdSeconds,
    @Positive double chunkSeconds,
    boolean retainNormalized,
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive long processTimeoutSeconds) {

  public static final List<String> DEFAULT_FORMATS =
      List.of(".wav", ".mp3", ".m4a", ".flac", ".ogg", ".aac", ".wma", ".mp4", ".webm", ".mov");

  public static AudioProperties defaults(String workDir) {
    return new AudioProperties(
        workDir, 500, DEFAULT_FORMATS, 16000, 600, 300, false, "ffmpeg", "ffprobe", 600);
  }

  public long maxUploadBytes() {
    return maxUploadMb * 1024 * 1024;
  }
}
