package com.scholary.transcriber.capability;

import com.scholary.transcriber.transcript.TranscriptSegment;
import java.util.List;

/**
 * What the recognizer returns for one file or chunk. Timestamps are local to that input.
 *
 * @param language detected language, or the hint echoed back; may be null
 * @param duration input duration as the recognizer measured it; 0 when unknown
 */
public record TranscriberOutput(
    List<TranscriptSegment> segments, String language, double duration) {

  public TranscriberOutput {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
