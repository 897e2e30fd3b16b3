package com.scholary.transcriber.config;

import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the optional transcript archive.
 *
 * <p>The S3 client only exists when {@code objectstore.enabled} is true; without it, completed
 * jobs are simply not archived.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
