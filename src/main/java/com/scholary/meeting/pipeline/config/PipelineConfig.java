package com.scholary.meeting.pipeline.config;

import com.scholary.meeting.pipeline.dispatch.StageTimeLimiter;
import com.scholary.meeting.pipeline.idempotency.IdempotencyGuardFactory;
import com.scholary.meeting.pipeline.idempotency.IdempotencyLedger;
import com.scholary.meeting.pipeline.idempotency.IdempotencyStore;
import com.scholary.meeting.pipeline.pipeline.PipelineGraph;
import com.scholary.meeting.pipeline.retry.BackoffPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Core pipeline wiring: stage order, retry policy, idempotency guards and stage time limits.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public PipelineGraph pipelineGraph() {
    return PipelineGraph.standard();
  }

  @Bean
  public BackoffPolicy backoffPolicy(PipelineProperties properties) {
    PipelineProperties.Retry retry = properties.retry();
    return new BackoffPolicy(retry.baseDelay(), retry.maxDelay(), retry.maxRetries());
  }

  @Bean
  public IdempotencyLedger idempotencyLedger(
      IdempotencyStore store, PipelineProperties properties) {
    return new IdempotencyLedger(
        store,
        properties.idempotency().processingTtl(),
        properties.idempotency().completedTtl());
  }

  @Bean
  public IdempotencyGuardFactory idempotencyGuardFactory(IdempotencyLedger ledger) {
    return new IdempotencyGuardFactory(ledger, ledger);
  }

  @Bean
  public StageTimeLimiter stageTimeLimiter(
      @Qualifier("stageExecutor") AsyncTaskExecutor stageExecutor,
      PipelineProperties properties) {
    return new StageTimeLimiter(
        stageExecutor,
        properties.worker().softTimeLimit(),
        properties.worker().hardTimeLimit());
  }
}
