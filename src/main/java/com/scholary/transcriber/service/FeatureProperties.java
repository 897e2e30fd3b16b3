package com.scholary.transcriber.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Switches for optional endpoints. */
@ConfigurationProperties(prefix = "features")
public record FeatureProperties(boolean translationEnabled) {}
