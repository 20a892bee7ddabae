package com.scholary.meeting.pipeline.idempotency;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Idempotency store shared by all workers through Redis.
 *
 * <p>Set-if-absent maps to {@code SET key value NX EX ttl}, which Redis executes atomically.
 */
public class RedisIdempotencyStore implements IdempotencyStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisIdempotencyStore.class);

  private final StringRedisTemplate redisTemplate;

  public RedisIdempotencyStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
    LOGGER.info("Initialized Redis idempotency store");
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(key, value, ttl);
  }

  @Override
  public void delete(String key) {
    redisTemplate.delete(key);
  }
}
