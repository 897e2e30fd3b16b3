package com.scholary.transcriber.audio;

/** What ffprobe reports about a file. */
public record AudioInfo(double durationSeconds, int sampleRate, int channels, String formatName) {}
