package com.scholary.transcriber.capability.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.capability.TranscriberOutput;
import com.scholary.transcriber.transcript.TranscriptSegment;
import com.scholary.transcriber.transcript.Word;
import java.util.List;
import org.junit.jupiter.api.Test;

class WhisperClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void toOutput_shouldMapSegmentsAndWords() throws Exception {
    String json =
        "{\"language\":\"en\",\"duration\":4.5,\"segments\":["
            + "{\"id\":7,\"start\":0.0,\"end\":2.0,\"text\":\" Hello there \","
            + "\"avg_logprob\":-0.2,\"no_speech_prob\":0.01,"
            + "\"words\":[{\"word\":\" Hello\",\"start\":0.0,\"end\":0.8,\"probability\":0.95},"
            + "{\"word\":\" there\",\"start\":0.9,\"end\":2.0,\"probability\":0.9}]}]}";
    WhisperResponse response = objectMapper.readValue(json, WhisperResponse.class);

    TranscriberOutput output = WhisperClient.toOutput(response, null);

    assertThat(output.language()).isEqualTo("en");
    assertThat(output.duration()).isEqualTo(4.5);
    TranscriptSegment segment = output.segments().get(0);
    assertThat(segment.id()).isZero();
    assertThat(segment.text()).isEqualTo("Hello there");
    assertThat(segment.confidence()).isCloseTo(Math.exp(-0.2), within(1e-9));
    assertThat(segment.words()).extracting(Word::text).containsExactly("Hello", "there");
    assertThat(segment.speaker()).isNull();
  }

  @Test
  void toOutput_shouldPreferExplicitConfidenceAndClampIt() {
    WhisperResponse response =
        new WhisperResponse(
            List.of(
                new WhisperResponse.Segment(0, 0.0, 1.0, "a", -0.1, 1.7, null),
                new WhisperResponse.Segment(1, 1.0, 2.0, "b", null, null, null)),
            "de",
            null);

    TranscriberOutput output = WhisperClient.toOutput(response, "de");

    assertThat(output.segments())
        .extracting(TranscriptSegment::confidence)
        .containsExactly(1.0, 0.0);
    assertThat(output.duration()).isZero();
  }

  @Test
  void toOutput_shouldFallBackToLanguageHint() {
    WhisperResponse response = new WhisperResponse(null, "", 3.0);

    TranscriberOutput output = WhisperClient.toOutput(response, "fr");

    assertThat(output.language()).isEqualTo("fr");
    assertThat(output.segments()).isEmpty();
  }
}
