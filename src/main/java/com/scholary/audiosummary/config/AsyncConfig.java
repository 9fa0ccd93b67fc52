package com.scholary.audiosummary.config;

import com.scholary.audiosummary.logging.MdcTaskDecorator;
import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Three bounded pools:
 *
 * <ul>
 *   <li>{@code jobExecutor} runs whole pipeline runs (async jobs and streamed runs)
 *   <li>{@code transcriptionExecutor} runs segment transcription tasks; the semaphore in the
 *       transcription service, not this pool, bounds in-flight backend calls
 *   <li>{@code streamExecutor} writes queued progress events to server-sent event clients
 * </ul>
 */
@Configuration
@EnableAsync
@EnableConfigurationProperties(PipelineProperties.class)
public class AsyncConfig {

  @Bean(name = {"jobExecutor", "taskExecutor"})
  public Executor jobExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobExecutorThreads());
    executor.setMaxPoolSize(properties.jobExecutorThreads());
    executor.setQueueCapacity(properties.jobExecutorQueueSize());
    executor.setThreadNamePrefix("pipeline-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "transcriptionExecutor")
  public Executor transcriptionExecutor(PipelineProperties properties) {
    int threads = properties.transcription().maxConcurrentCalls();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("transcription-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamExecutor")
  public Executor streamExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobExecutorThreads());
    executor.setMaxPoolSize(properties.jobExecutorThreads());
    executor.setQueueCapacity(properties.jobExecutorQueueSize());
    executor.setThreadNamePrefix("sse-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
