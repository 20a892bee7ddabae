package com.scholary.meeting.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.pipeline.deadletter.DeadLetterRecorder;
import com.scholary.meeting.pipeline.deadletter.InMemoryDeadLetterRecorder;
import com.scholary.meeting.pipeline.deadletter.RedisDeadLetterRecorder;
import com.scholary.meeting.pipeline.idempotency.CaffeineIdempotencyStore;
import com.scholary.meeting.pipeline.idempotency.IdempotencyStore;
import com.scholary.meeting.pipeline.idempotency.RedisIdempotencyStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Idempotency markers and dead letters, kept in this process (memory) or in Redis.
 *
 * <p>Use Redis whenever more than one worker process shares the queues; the in-memory store only
 * deduplicates within one JVM.
 */
@Configuration
public class StoreConfig {

  @Configuration
  @ConditionalOnProperty(name = "pipeline.store.type", havingValue = "memory", matchIfMissing = true)
  static class MemoryStoreConfig {

    @Bean
    public IdempotencyStore idempotencyStore(PipelineProperties properties) {
      return new CaffeineIdempotencyStore(properties.idempotency().maxEntries());
    }

    @Bean
    public DeadLetterRecorder deadLetterRecorder(PipelineProperties properties) {
      return new InMemoryDeadLetterRecorder(properties.deadLetter().capacity());
    }
  }

  @Configuration
  @ConditionalOnProperty(name = "pipeline.store.type", havingValue = "redis")
  static class RedisStoreConfig {

    @Bean
    public IdempotencyStore idempotencyStore(StringRedisTemplate redisTemplate) {
      return new RedisIdempotencyStore(redisTemplate);
    }

    @Bean
    public DeadLetterRecorder deadLetterRecorder(
        StringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        PipelineProperties properties) {
      return new RedisDeadLetterRecorder(
          redisTemplate,
          objectMapper,
          properties.deadLetter().redisKey(),
          properties.deadLetter().capacity());
    }
  }
}
