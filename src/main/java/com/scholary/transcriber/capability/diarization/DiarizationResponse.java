package com.scholary.transcriber.capability.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DiarizationResponse(List<Turn> turns) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Turn(double start, double end, String speaker) {}
}
