package com.scholary.meeting.pipeline.config;

import com.scholary.meeting.pipeline.dispatch.InProcessTaskDispatcher;
import com.scholary.meeting.pipeline.dispatch.TaskProcessor;
import com.scholary.meeting.pipeline.logging.MdcTaskDecorator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Default dispatcher: tasks run on a bounded pool inside this process, one stage per thread.
 */
@Configuration
@ConditionalOnProperty(
    name = "pipeline.dispatcher.type",
    havingValue = "in-process",
    matchIfMissing = true)
public class InProcessDispatcherConfig {

  @Bean(name = "workerExecutor")
  public ThreadPoolTaskExecutor workerExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.worker().threads());
    executor.setMaxPoolSize(properties.worker().threads());
    executor.setQueueCapacity(properties.worker().queueCapacity());
    executor.setThreadNamePrefix("worker-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean
  public InProcessTaskDispatcher inProcessTaskDispatcher(
      @Qualifier("workerExecutor") ThreadPoolTaskExecutor workerExecutor,
      @Qualifier("retryScheduler") ThreadPoolTaskScheduler retryScheduler,
      TaskProcessor taskProcessor,
      PipelineProperties properties) {
    return new InProcessTaskDispatcher(
        workerExecutor, retryScheduler, taskProcessor, properties.worker().requeueDelay());
  }
}
