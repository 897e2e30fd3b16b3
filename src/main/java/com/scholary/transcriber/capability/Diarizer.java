package com.scholary.transcriber.capability;

import com.scholary.transcriber.transcript.SpeakerTurn;
import java.nio.file.Path;
import java.util.List;

/** Splits a whole file into speaker turns. */
public interface Diarizer {

  /**
   * @param numSpeakersHint expected number of speakers, or null to detect it
   * @return turns ordered by start
   * @throws DiarizationException if diarization fails
   */
  List<SpeakerTurn> diarize(Path audio, Integer numSpeakersHint);
}
