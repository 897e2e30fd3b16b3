package com.scholary.transcriber.capability.translation;

import com.scholary.transcriber.capability.RemoteCapabilityProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration for the translation server, bound to {@code capabilities.translation.*}. */
@ConfigurationProperties(prefix = "capabilities.translation")
@Validated
public record TranslationProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String model,
    @NotBlank String device,
    boolean serializeCalls)
    implements RemoteCapabilityProperties {}
