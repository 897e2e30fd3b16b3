package com.scholary.transcriber.capability.diarization;

import com.scholary.transcriber.capability.RemoteCapabilityProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the pyannote diarization server, bound to {@code capabilities.diarization.*}.
 *
 * @param authToken Hugging Face token the server needs to fetch the pipeline
 */
@ConfigurationProperties(prefix = "capabilities.diarization")
@Validated
public record DiarizationProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String model,
    @NotBlank String device,
    String authToken,
    boolean serializeCalls)
    implements RemoteCapabilityProperties {}
