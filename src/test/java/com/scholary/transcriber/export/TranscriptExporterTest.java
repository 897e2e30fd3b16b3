package com.scholary.transcriber.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.TranscriptionResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptExporterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TranscriptExporter exporter;
  private TranscriptionResult result;

  @BeforeEach
  void setUp() {
    exporter = new TranscriptExporter(objectMapper);
    result =
        TranscriptionResult.of(
            List.of(
                new TranscriptSegment(0, "Hello world", 0.0, 5.2, 0.9)
                    .withSpeaker("SPEAKER_00"),
                new TranscriptSegment(1, "This is a test", 5.2, 10.5, 0.8)
                    .withSpeaker("SPEAKER_01")),
            "en",
            10.5,
            List.of());
  }

  @Test
  void export_shouldWriteTextWithSpeakerNames() {
    String text =
        new String(
            exporter.export(result, ExportFormat.TXT, Map.of("SPEAKER_00", "Alice")),
            StandardCharsets.UTF_8);

    assertThat(text).isEqualTo("[Alice]: Hello world\n\n[SPEAKER_01]: This is a test");
  }

  @Test
  void export_shouldWritePlainTextWithoutSpeakers() {
    TranscriptionResult unlabeled =
        TranscriptionResult.of(
            List.of(new TranscriptSegment(0, "Just words", 0.0, 1.0, 0.9)), "en", 1.0, List.of());

    String text =
        new String(exporter.export(unlabeled, ExportFormat.TXT, null), StandardCharsets.UTF_8);

    assertThat(text).isEqualTo("Just words");
  }

  @Test
  void export_shouldWriteSrtBlocks() {
    String srt =
        new String(
            exporter.export(result, ExportFormat.SRT, Map.of("SPEAKER_01", "Bob")),
            StandardCharsets.UTF_8);

    assertThat(srt)
        .isEqualTo(
            "1\n00:00:00,000 --> 00:00:05,200\n[SPEAKER_00] Hello world\n\n"
                + "2\n00:00:05,200 --> 00:00:10,500\n[Bob] This is a test\n\n");
  }

  @Test
  void export_shouldWriteJsonWithSpeakerNamesOnlyWhenGiven() throws IOException {
    JsonNode plain = objectMapper.readTree(exporter.export(result, ExportFormat.JSON, Map.of()));
    JsonNode named =
        objectMapper.readTree(
            exporter.export(result, ExportFormat.JSON, Map.of("SPEAKER_00", "Alice")));

    assertThat(plain.get("text").asText()).isEqualTo("Hello world This is a test");
    assertThat(plain.get("language").asText()).isEqualTo("en");
    assertThat(plain.get("segments")).hasSize(2);
    assertThat(plain.get("segments").get(1).get("speaker").asText()).isEqualTo("SPEAKER_01");
    assertThat(plain.has("speaker_names")).isFalse();
    assertThat(named.get("speaker_names").get("SPEAKER_00").asText()).isEqualTo("Alice");
  }

  @Test
  void export_shouldBeDeterministic() {
    Map<String, String> names = Map.of("SPEAKER_00", "Alice");

    assertThat(exporter.export(result, ExportFormat.JSON, names))
        .isEqualTo(exporter.export(result, ExportFormat.JSON, names));
  }

  @Test
  void formatSrtTime_shouldRoundToMilliseconds() {
    assertThat(TranscriptExporter.formatSrtTime(0.0)).isEqualTo("00:00:00,000");
    assertThat(TranscriptExporter.formatSrtTime(3725.4567)).isEqualTo("01:02:05,457");
    assertThat(TranscriptExporter.formatSrtTime(59.9996)).isEqualTo("00:01:00,000");
  }

  @Test
  void fromValue_shouldAcceptKnownFormatsCaseInsensitively() {
    assertThat(ExportFormat.fromValue("SRT")).isEqualTo(ExportFormat.SRT);
    assertThat(ExportFormat.fromValue("json")).isEqualTo(ExportFormat.JSON);
    assertThatThrownBy(() -> ExportFormat.fromValue("docx"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Unsupported export format: docx");
  }
}
