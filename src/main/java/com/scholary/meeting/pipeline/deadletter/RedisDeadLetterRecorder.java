package com.scholary.meeting.pipeline.deadletter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Dead letters as JSON entries in a Redis list.
 *
 * <p>{@code LPUSH} then {@code LTRIM 0 capacity-1}, so the head is the newest record and the list
 * never outgrows the cap. Shared by every worker process.
 */
public class RedisDeadLetterRecorder implements DeadLetterRecorder {

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final String key;
  private final int capacity;

  public RedisDeadLetterRecorder(
      StringRedisTemplate redis, ObjectMapper objectMapper, String key, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.key = key;
    this.capacity = capacity;
  }

  @Override
  public void record(DeadLetterRecord deadLetter) {
    String json;
    try {
      json = objectMapper.writeValueAsString(deadLetter);
    } catch (JsonProcessingException e) {
      throw new DeadLetterException("Could not serialize dead letter " + deadLetter.taskId(), e);
    }
    redis.opsForList().leftPush(key, json);
    redis.opsForList().trim(key, 0, capacity - 1L);
  }

  @Override
  public List<DeadLetterRecord> recent(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<String> entries = redis.opsForList().range(key, 0, limit - 1L);
    List<DeadLetterRecord> records = new ArrayList<>();
    if (entries == null) {
      return records;
    }
    for (String entry : entries) {
      try {
        records.add(objectMapper.readValue(entry, DeadLetterRecord.class));
      } catch (JsonProcessingException e) {
        throw new DeadLetterException("Unreadable dead-letter entry in " + key, e);
      }
    }
    return records;
  }

  @Override
  public long size() {
    Long size = redis.opsForList().size(key);
    return size == null ? 0 : size;
  }
}
