package com.scholary.transcriber.config;

import com.scholary.transcriber.capability.diarization.DiarizationProperties;
import com.scholary.transcriber.capability.translation.TranslationProperties;
import com.scholary.transcriber.capability.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the model servers.
 *
 * <p>Enables the whisper, diarization and translation properties to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  WhisperProperties.class,
  DiarizationProperties.class,
  TranslationProperties.class
})
public class CapabilityConfig {}
