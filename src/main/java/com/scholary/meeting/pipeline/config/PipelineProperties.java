package com.scholary.meeting.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the processing pipeline.
 *
 * <p>{@code pipeline.store.type} (memory | redis) and {@code pipeline.dispatcher.type} (in-process |
 * rabbit) pick the implementations and are read by the configuration conditions.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Valid @NotNull Retry retry,
    @Valid @NotNull Idempotency idempotency,
    @Valid @NotNull Worker worker,
    @Valid @NotNull DeadLetter deadLetter,
    @Valid @NotNull Rabbit rabbit) {

  /** delay(attempt) = min(baseDelay * 2^attempt, maxDelay); at most maxRetries redeliveries. */
  public record Retry(
      @NotNull Duration baseDelay, @NotNull Duration maxDelay, @PositiveOrZero int maxRetries) {}

  public record Idempotency(
      @NotNull Duration processingTtl, @NotNull Duration completedTtl, @Positive long maxEntries) {}

  public record Worker(
      @Positive int threads,
      @PositiveOrZero int queueCapacity,
      @NotNull Duration softTimeLimit,
      @NotNull Duration hardTimeLimit,
      @NotNull Duration requeueDelay) {}

  public record DeadLetter(@Positive int capacity, @NotBlank String redisKey) {}

  public record Rabbit(
      @NotBlank String exchange,
      @NotBlank String workQueue,
      @NotBlank String retryQueuePrefix,
      @NotBlank String deadLetterQueue) {}
}
