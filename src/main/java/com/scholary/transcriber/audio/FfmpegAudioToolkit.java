package com.scholary.transcriber.audio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AudioToolkit} backed by the ffmpeg and ffprobe binaries.
 *
 * <p>Each call starts one process with {@link ProcessBuilder}, sends stdout and stderr to a
 * temporary log file and waits at most {@code audio.processTimeoutSeconds}, killing the process
 * when the limit is hit. A non-zero exit code becomes an {@link IOException} carrying the tail of
 * the tool's output.
 */
@Component
public class FfmpegAudioToolkit implements AudioToolkit {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioToolkit.class);

  private static final int OUTPUT_TAIL_CHARS = 500;

  private final AudioProperties properties;
  private final ObjectMapper objectMapper;

  public FfmpegAudioToolkit(AudioProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public AudioInfo probe(Path input) throws IOException {
    String output =
        run(
            List.of(
                properties.ffprobePath(),
                "-v",
                "error",
                "-print_format",
                "json",
                "-show_format",
                "-show_streams",
                "-select_streams",
                "a:0",
                input.toString()));

    JsonNode root = objectMapper.readTree(output);
    JsonNode streams = root.path("streams");
    if (!streams.isArray() || streams.isEmpty()) {
      throw new IOException("No audio stream found in " + input.getFileName());
    }
    JsonNode stream = streams.get(0);
    JsonNode format = root.path("format");

    double duration = format.path("duration").asDouble(stream.path("duration").asDouble(0.0));
    int sampleRate = stream.path("sample_rate").asInt(0);
    int channels = stream.path("channels").asInt(0);
    String formatName = format.path("format_name").asText("unknown");

    LOGGER.debug(
        "Probed {}: duration={}s, sampleRate={}, channels={}, format={}",
        input.getFileName(),
        duration,
        sampleRate,
        channels,
        formatName);
    return new AudioInfo(duration, sampleRate, channels, formatName);
  }

  @Override
  public void normalize(Path input, Path output, int sampleRate) throws IOException {
    // -vn: drop video, -ac 1: mono, -ar: resample, pcm_s16le: 16-bit PCM
    run(
        List.of(
            properties.ffmpegPath(),
            "-nostdin",
            "-v",
            "error",
            "-y",
            "-i",
            input.toString(),
            "-vn",
            "-ac",
            "1",
            "-ar",
            String.valueOf(sampleRate),
            "-c:a",
            "pcm_s16le",
            output.toString()));
  }

  @Override
  public void cut(Path input, TimeRange range, Path output) throws IOException {
    // PCM has no keyframes, so stream copy cuts exactly at the requested samples.
    run(
        List.of(
            properties.ffmpegPath(),
            "-nostdin",
            "-v",
            "error",
            "-y",
            "-ss",
            String.format(Locale.ROOT, "%.3f", range.start()),
            "-t",
            String.format(Locale.ROOT, "%.3f", range.duration()),
            "-i",
            input.toString(),
            "-c",
            "copy",
            output.toString()));
  }

  private String run(List<String> command) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path log = Files.createTempFile("audio-tool-", ".log");
    try {
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(log.toFile());
      Process process = pb.start();
      try {
        if (!process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS)) {
          process.destroyForcibly();
          throw new IOException(
              command.get(0) + " timed out after " + properties.processTimeoutSeconds() + "s");
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException(command.get(0) + " interrupted", e);
      }
      String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new IOException(
            command.get(0) + " failed with exit code " + exitCode + ": " + tail(output));
      }
      return output;
    } finally {
      Files.deleteIfExists(log);
    }
  }

  private static String tail(String output) {
    String trimmed = output.trim();
    return trimmed.length() <= OUTPUT_TAIL_CHARS
        ? trimmed
        : trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
  }
}
