package com.scholary.transcriber.config;

import com.scholary.transcriber.audio.AudioProperties;
import com.scholary.transcriber.job.JobStoreProperties;
import com.scholary.transcriber.service.FeatureProperties;
import com.scholary.transcriber.transcript.MergeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Loads the job, audio, merge and feature settings from application.yml. */
@Configuration
@EnableConfigurationProperties({
  AudioProperties.class,
  JobStoreProperties.class,
  MergeProperties.class,
  FeatureProperties.class
})
public class TranscriberConfig {}
