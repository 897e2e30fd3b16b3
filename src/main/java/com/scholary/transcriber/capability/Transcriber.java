package com.scholary.transcriber.capability;

import java.nio.file.Path;

/** Speech recognition over a mono 16 kHz WAV file. */
public interface Transcriber {

  /**
   * @param languageHint language code, or null to detect it
   * @throws TranscriptionException if recognition fails
   */
  TranscriberOutput transcribe(Path audio, String languageHint);
}
