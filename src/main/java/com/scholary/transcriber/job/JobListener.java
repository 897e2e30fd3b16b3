package com.scholary.transcriber.job;

/** Callback for applied job transitions. Runs on the thread that made the transition. */
@FunctionalInterface
public interface JobListener {

  void onTransition(TranscriptionJob job);
}
