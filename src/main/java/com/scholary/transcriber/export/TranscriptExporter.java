package com.scholary.transcriber.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders a completed transcript as TXT, JSON or SRT.
 *
 * <p>Pure formatting: the same result and speaker names always produce the same bytes. Speaker
 * display names replace raw labels in TXT and SRT and are added as {@code speaker_names} to JSON.
 */
@Component
public class TranscriptExporter {

  private final ObjectMapper objectMapper;

  public TranscriptExporter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] export(
      TranscriptionResult result, ExportFormat format, Map<String, String> speakerNames) {
    Map<String, String> names = speakerNames == null ? Map.of() : speakerNames;
    switch (format) {
      case TXT:
        return writeText(result, names).getBytes(StandardCharsets.UTF_8);
      case SRT:
        return writeSrt(result.segments(), names).getBytes(StandardCharsets.UTF_8);
      case JSON:
        return writeJson(result, names);
      default:
        throw new IllegalArgumentException("Unknown format: " + format);
    }
  }

  /** Segments separated by blank lines, each prefixed with {@code [speaker]: } when labeled. */
  public String writeText(TranscriptionResult result, Map<String, String> speakerNames) {
    return result.segments().stream()
        .map(
            segment -> {
              String speaker = displayName(segment, speakerNames);
              return speaker == null ? segment.text() : "[" + speaker + "]: " + segment.text();
            })
        .collect(Collectors.joining("\n\n"));
  }

  /**
   * Write transcript as JSON: the result as-is, plus the caller's speaker names.
   *
   * <pre>
   * {
   *   "text": "Hello world",
   *   "segments": [{"id": 0, "text": "Hello world", "start": 0.0, "end": 5.2, ...}],
   *   "language": "en",
   *   "duration": 5.2,
   *   "warnings": [],
   *   "speaker_names": {"SPEAKER_00": "Alice"}
   * }
   * </pre>
   */
  public byte[] writeJson(TranscriptionResult result, Map<String, String> speakerNames) {
    ObjectNode tree = objectMapper.valueToTree(result);
    if (!speakerNames.isEmpty()) {
      tree.set("speaker_names", objectMapper.valueToTree(speakerNames));
    }
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(tree);
    } catch (JsonProcessingException e) {
      throw new TranscriberException(
          ErrorKind.INTERNAL_ERROR, "Failed to render transcript", e.getOriginalMessage(), e);
    }
  }

  /**
   * Write transcript as SRT (SubRip subtitle format).
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * [Alice] Hello world
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * This is a test
   * </pre>
   */
  public String writeSrt(List<TranscriptSegment> segments, Map<String, String> speakerNames) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < segments.size(); i++) {
      TranscriptSegment segment = segments.get(i);

      srt.append(i + 1).append("\n");
      srt.append(formatSrtTime(segment.start()))
          .append(" --> ")
          .append(formatSrtTime(segment.end()))
          .append("\n");

      String speaker = displayName(segment, speakerNames);
      if (speaker != null) {
        srt.append('[').append(speaker).append("] ");
      }
      srt.append(segment.text()).append("\n");

      srt.append("\n");
    }

    return srt.toString();
  }

  /** Format: HH:MM:SS,mmm. Rounded to the nearest millisecond. */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(Math.max(0.0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  private static String displayName(TranscriptSegment segment, Map<String, String> speakerNames) {
    if (segment.speaker() == null) {
      return null;
    }
    String name = speakerNames.get(segment.speaker());
    return name == null || name.isBlank() ? segment.speaker() : name;
  }
}
