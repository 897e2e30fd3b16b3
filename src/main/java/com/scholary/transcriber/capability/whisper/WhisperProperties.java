package com.scholary.transcriber.capability.whisper;

import com.scholary.transcriber.capability.RemoteCapabilityProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the faster-whisper model server, bound to {@code capabilities.whisper.*}.
 *
 * <p>{@code model} is the default model size; a job may ask for another one, which the server
 * loads on first use. {@code serializeCalls} makes jobs sharing one model take turns.
 */
@ConfigurationProperties(prefix = "capabilities.whisper")
@Validated
public record WhisperProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String model,
    @NotBlank String device,
    @NotBlank String computeType,
    @Positive int beamSize,
    boolean vadFilter,
    boolean serializeCalls)
    implements RemoteCapabilityProperties {}
