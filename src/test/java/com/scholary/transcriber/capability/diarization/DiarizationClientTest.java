package com.scholary.transcriber.capability.diarization;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.transcriber.transcript.SpeakerTurn;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiarizationClientTest {

  @Test
  void toTurns_shouldDropUnusableTurnsAndSortByStart() {
    DiarizationResponse response =
        new DiarizationResponse(
            List.of(
                new DiarizationResponse.Turn(5.0, 8.0, "SPEAKER_01"),
                new DiarizationResponse.Turn(0.0, 5.0, "SPEAKER_00"),
                new DiarizationResponse.Turn(3.0, 3.0, "SPEAKER_02"),
                new DiarizationResponse.Turn(4.0, 6.0, " ")));

    List<SpeakerTurn> turns = DiarizationClient.toTurns(response);

    assertThat(turns)
        .containsExactly(
            new SpeakerTurn(0.0, 5.0, "SPEAKER_00"), new SpeakerTurn(5.0, 8.0, "SPEAKER_01"));
  }

  @Test
  void toTurns_shouldTreatMissingTurnsAsNone() {
    assertThat(DiarizationClient.toTurns(new DiarizationResponse(null))).isEmpty();
  }
}
