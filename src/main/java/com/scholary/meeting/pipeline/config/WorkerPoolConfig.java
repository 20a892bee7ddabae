package com.scholary.meeting.pipeline.config;

import com.scholary.meeting.pipeline.logging.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for stage execution.
 *
 * <p>{@code stageExecutor} runs the stage bodies under the time limiter. It has no queue and
 * twice the worker count, so a stage abandoned at its hard limit does not starve the next one.
 */
@Configuration
public class WorkerPoolConfig {

  @Bean(name = "stageExecutor")
  public ThreadPoolTaskExecutor stageExecutor(PipelineProperties properties) {
    int threads = properties.worker().threads();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads * 2);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("stage-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean(name = "retryScheduler")
  public ThreadPoolTaskScheduler retryScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("retry-");
    scheduler.initialize();
    return scheduler;
  }
}
