package com.scholary.transcriber.audio;

import java.nio.file.Path;

/**
 * An upload written to the work directory, waiting for its job to run.
 *
 * @param path where the bytes were written
 * @param originalName the file name the client declared
 * @param sizeBytes number of bytes written
 */
public record StagedUpload(Path path, String originalName, long sizeBytes) {}
