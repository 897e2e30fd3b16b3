package com.scholary.transcriber.config;

import com.scholary.transcriber.scheduler.SchedulerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for transcription jobs.
 *
 * <p>A fixed number of workers share one queue. Core and max pool size are equal so the queue
 * fills before any extra thread would be created. {@link EnableScheduling} drives the stuck job
 * reconciler.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulerProperties.class)
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public ThreadPoolTaskExecutor jobExecutor(SchedulerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentJobs());
    executor.setMaxPoolSize(properties.maxConcurrentJobs());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
